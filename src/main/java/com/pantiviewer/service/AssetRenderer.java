package com.pantiviewer.service;

import com.pantiviewer.util.ProjectLogger;
import net.coobird.thumbnailator.Thumbnails;
import org.jcodec.api.FrameGrab;
import org.jcodec.api.JCodecException;
import org.jcodec.common.model.Picture;
import org.jcodec.scale.AWTUtil;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes an original and encodes it as a JPEG fitting a bounding box.
 * <p>
 * Videos: first frame through JCodec (MP4/MOV), then ffmpeg.
 * Images: Thumbnailator over ImageIO (with the TwelveMonkeys plugins), then ffmpeg for the
 * formats ImageIO cannot read. Images are never upscaled.
 */
public class AssetRenderer {

    private static final String CONTEXT = "AssetRenderer";
    private static final double JPEG_QUALITY = 0.8;

    private final FFmpegService ffmpegService;

    public AssetRenderer(FFmpegService ffmpegService) {
        this.ffmpegService = ffmpegService;
    }

    /**
     * @param source       The original file
     * @param video        Whether the original is a video
     * @param boundingSize Maximum width and height of the result
     * @return The encoded JPEG
     * @throws AssetRenderException if no decoder could read the original
     */
    public byte[] render(Path source, boolean video, int boundingSize) throws AssetRenderException {
        File file = source.toFile();
        BufferedImage frame = video ? decodeVideo(file, boundingSize) : decodeImage(file, boundingSize);
        if (frame == null) {
            throw new AssetRenderException("No decoder could read " + source);
        }
        try {
            return encode(frame, boundingSize);
        } catch (IOException e) {
            throw new AssetRenderException("Failed to encode " + source, e);
        }
    }

    private BufferedImage decodeVideo(File file, int boundingSize) {
        try {
            Picture picture = FrameGrab.getFrameFromFile(file, 0);
            if (picture != null) {
                return AWTUtil.toBufferedImage(picture);
            }
        } catch (IOException | JCodecException | RuntimeException e) {
            ProjectLogger.logDebug(file.getParentFile().toPath(), CONTEXT,
                    "JCodec could not read " + file.getName() + ", trying ffmpeg: " + e.getMessage());
        }
        return ffmpegService.extractVideoFrame(file, boundingSize);
    }

    private BufferedImage decodeImage(File file, int boundingSize) {
        try {
            // Applies the EXIF orientation
            return Thumbnails.of(file).scale(1.0).asBufferedImage();
        } catch (IOException | RuntimeException e) {
            ProjectLogger.logDebug(file.getParentFile().toPath(), CONTEXT,
                    "ImageIO could not read " + file.getName() + ", trying ffmpeg: " + e.getMessage());
        }
        return ffmpegService.decodeImage(file, boundingSize);
    }

    private byte[] encode(BufferedImage frame, int boundingSize) throws IOException {
        BufferedImage rgb = toRgb(frame);
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        Thumbnails.Builder<BufferedImage> builder = Thumbnails.of(rgb);
        if (rgb.getWidth() <= boundingSize && rgb.getHeight() <= boundingSize) {
            builder.scale(1.0);
        } else {
            builder.size(boundingSize, boundingSize);
        }
        builder.outputFormat("jpg")
                .outputQuality(JPEG_QUALITY)
                .toOutputStream(baos);
        return baos.toByteArray();
    }

    // JPEG has no alpha channel
    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, image.getWidth(), image.getHeight());
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
