package com.pantiviewer.service;

/**
 * No decoder could produce a frame for a derived asset.
 */
public class AssetRenderException extends Exception {

    public AssetRenderException(String message) {
        super(message);
    }

    public AssetRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
