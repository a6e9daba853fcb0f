package com.pantiviewer.service;

import com.pantiviewer.model.AssetSource;

import java.util.Optional;

/**
 * Finds a readable original for a content checksum.
 */
@FunctionalInterface
public interface AssetSourceResolver {
    Optional<AssetSource> resolve(String checksum);
}
