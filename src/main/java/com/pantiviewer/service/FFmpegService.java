package com.pantiviewer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pantiviewer.util.ProjectLogger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Wraps the system ffmpeg and ffprobe binaries. Used for video stream dimensions, video
 * frame capture, and decoding image formats ImageIO cannot read (HEIC, HEIF).
 * Every failure degrades to an empty result; nothing is thrown to the caller.
 */
public class FFmpegService {

    private static final long TIMEOUT_SECONDS = 15;
    private static final int MAX_ERROR_CHARS = 2000;

    private final String ffmpegPath;
    private final String ffprobePath;
    private final ObjectMapper mapper = new ObjectMapper();

    public FFmpegService(String ffmpegPath, String ffprobePath) {
        this.ffmpegPath = ffmpegPath;
        this.ffprobePath = ffprobePath;
    }

    /**
     * Pixel dimensions of the first video stream.
     */
    public static class Dimensions {
        private final int width;
        private final int height;

        public Dimensions(int width, int height) {
            this.width = width;
            this.height = height;
        }

        public int getWidth() { return width; }
        public int getHeight() { return height; }
    }

    /**
     * Reads the width and height of the first video stream with ffprobe.
     *
     * @param videoFile The video to probe
     * @return The dimensions, or empty if the prober failed or found no video stream
     */
    public Optional<Dimensions> probeDimensions(File videoFile) {
        List<String> command = new ArrayList<>();
        command.add(ffprobePath);
        command.add("-v"); command.add("error");
        command.add("-select_streams"); command.add("v:0");
        command.add("-show_entries"); command.add("stream=width,height");
        command.add("-of"); command.add("json");
        command.add(videoFile.getAbsolutePath());

        Optional<byte[]> output = run(command, videoFile, "ffprobe_", ".json", true);
        if (output.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode streams = mapper.readTree(output.get()).path("streams");
            if (streams.isArray() && streams.size() > 0) {
                JsonNode stream = streams.get(0);
                if (stream.hasNonNull("width") && stream.hasNonNull("height")) {
                    return Optional.of(new Dimensions(stream.get("width").asInt(), stream.get("height").asInt()));
                }
            }
        } catch (IOException e) {
            ProjectLogger.logError(videoFile.getParentFile().toPath(), "FFmpegService", "Unparsable ffprobe output for " + videoFile, e);
        }
        return Optional.empty();
    }

    /**
     * Captures the first frame of a video, scaled down to fit the bounding size.
     *
     * @param videoFile    The source video file
     * @param boundingSize The maximum width and height
     * @return The frame, or null if ffmpeg could not produce one
     */
    public BufferedImage extractVideoFrame(File videoFile, int boundingSize) {
        List<String> inputArgs = new ArrayList<>();
        inputArgs.add("-ss"); inputArgs.add("00:00:00");
        inputArgs.add("-i"); inputArgs.add(videoFile.getAbsolutePath());
        inputArgs.add("-map"); inputArgs.add("0:v:0"); // Take 1st video stream
        inputArgs.add("-frames:v"); inputArgs.add("1");
        return decode(inputArgs, videoFile, boundingSize, "vid_tmp_");
    }

    /**
     * Decodes an image format ImageIO cannot read (HEIC, HEIF), scaled down to fit the bounding size.
     */
    public BufferedImage decodeImage(File imageFile, int boundingSize) {
        List<String> inputArgs = new ArrayList<>();
        inputArgs.add("-probesize"); inputArgs.add("50M");
        inputArgs.add("-analyzeduration"); inputArgs.add("100M");
        inputArgs.add("-i"); inputArgs.add(imageFile.getAbsolutePath());
        inputArgs.add("-frames:v"); inputArgs.add("1");
        return decode(inputArgs, imageFile, boundingSize, "img_tmp_");
    }

    private BufferedImage decode(List<String> inputArgs, File source, int boundingSize, String tempPrefix) {
        List<String> command = new ArrayList<>();
        command.add(ffmpegPath);
        command.add("-hide_banner");
        command.add("-loglevel"); command.add("error");
        command.add("-y");
        command.addAll(inputArgs);

        // Fit inside the box, never upscale
        command.add("-vf");
        command.add("scale='min(" + boundingSize + ",iw)':'min(" + boundingSize + ",ih)'"
                + ":force_original_aspect_ratio=decrease,format=yuvj420p");
        command.add("-c:v"); command.add("mjpeg");
        command.add("-q:v"); command.add("2");
        command.add("-update"); command.add("1");

        Optional<byte[]> output = run(command, source, tempPrefix, ".jpg", false);
        if (output.isEmpty()) {
            return null;
        }
        try {
            return ImageIO.read(new ByteArrayInputStream(output.get()));
        } catch (IOException e) {
            ProjectLogger.logError(source.getParentFile().toPath(), "FFmpegService", "Unreadable ffmpeg output for " + source, e);
            return null;
        }
    }

    /**
     * Runs a command whose result lands in a temporary file, either through stdout or as
     * the last command argument.
     */
    private Optional<byte[]> run(List<String> command, File source, String tempPrefix, String tempSuffix, boolean captureStdout) {
        File tempOutput = null;
        File tempErrors = null;
        try {
            tempOutput = File.createTempFile(tempPrefix, tempSuffix);
            // stderr goes to a file so a verbose child can never block on a full pipe
            tempErrors = File.createTempFile(tempPrefix, ".err");
            List<String> fullCommand = new ArrayList<>(command);
            ProcessBuilder pb;
            if (captureStdout) {
                pb = new ProcessBuilder(fullCommand).redirectOutput(tempOutput);
            } else {
                fullCommand.add(tempOutput.getAbsolutePath());
                pb = new ProcessBuilder(fullCommand).redirectOutput(ProcessBuilder.Redirect.DISCARD);
            }
            Process p = pb.redirectError(tempErrors).start();

            boolean finished = p.waitFor(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                p.destroyForcibly();
                ProjectLogger.logRecurringError(source.getParentFile().toPath(), "FFmpegService",
                        command.get(0) + " timed out after " + TIMEOUT_SECONDS + "s", null);
                return Optional.empty();
            }

            if (p.exitValue() != 0 || tempOutput.length() == 0) {
                ProjectLogger.logRecurringError(source.getParentFile().toPath(), "FFmpegService",
                        command.get(0) + " failed with exit code " + p.exitValue() + " for " + source + ": " + readErrors(tempErrors), null);
                return Optional.empty();
            }
            return Optional.of(Files.readAllBytes(tempOutput.toPath()));

        } catch (IOException e) {
            // Typically the binary is not installed
            ProjectLogger.logRecurringError(null, "FFmpegService", "Could not run " + command.get(0), e);
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            deleteQuietly(tempOutput);
            deleteQuietly(tempErrors);
        }
    }

    private static void deleteQuietly(File file) {
        if (file != null && file.exists() && !file.delete()) {
            file.deleteOnExit();
        }
    }

    /**
     * The tail of what the process wrote to stderr, lines joined with " | ".
     */
    private String readErrors(File errors) throws IOException {
        String text = new String(Files.readAllBytes(errors.toPath()), StandardCharsets.UTF_8).trim().replaceAll("\\R+", " | ");
        return text.length() > MAX_ERROR_CHARS ? "..." + text.substring(text.length() - MAX_ERROR_CHARS) : text;
    }
}
