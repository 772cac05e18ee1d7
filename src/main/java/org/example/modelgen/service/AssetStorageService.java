package org.example.modelgen.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local layout of downloaded assets: {@code <static-root>/3d/products/<productId>/<file>},
 * served under the web path {@code /3d/products/<productId>/<file>}.
 */
@Service
public class AssetStorageService {

    private static final Logger log = LoggerFactory.getLogger(AssetStorageService.class);

    public static final String MODEL_FILENAME = "model.glb";
    public static final String PREVIEW_FILENAME = "preview.webp";
    private static final String PRODUCTS_PREFIX = "3d/products";

    private final Path staticRoot;

    public AssetStorageService(@Value("${assets.static-root:./data/static}") String staticRoot) {
        this.staticRoot = Paths.get(staticRoot).toAbsolutePath().normalize();
    }

    public Path productDirectory(String productId) {
        Path productsRoot = staticRoot.resolve(PRODUCTS_PREFIX).normalize();
        Path resolved = productsRoot.resolve(requireSafeSegment(productId)).normalize();
        if (!resolved.startsWith(productsRoot)) {
            throw new AssetDownloadException("Product id escapes asset root: " + productId);
        }
        return resolved;
    }

    public Path ensureProductDirectory(String productId) {
        Path directory = productDirectory(productId);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new AssetDownloadException("Failed to create asset directory " + directory, e);
        }
        return directory;
    }

    /**
     * Write a file into the product directory, replacing any previous (possibly partial) copy.
     */
    public Path write(String productId, String filename, byte[] content) {
        Path target = productDirectory(productId).resolve(filename);
        try {
            Files.write(target, content);
        } catch (IOException e) {
            log.error("Failed to write file to {}: {}", target, e.getMessage());
            throw new AssetDownloadException("Failed to write " + target, e);
        }
        log.info("Saved {} bytes to {}", content.length, target);
        return target;
    }

    public byte[] read(String productId, String filename) {
        Path target = productDirectory(productId).resolve(filename);
        try {
            return Files.exists(target) ? Files.readAllBytes(target) : null;
        } catch (IOException e) {
            log.error("Failed to read asset {}", target, e);
            return null;
        }
    }

    public String relativeModelPath(String productId) {
        return "/" + PRODUCTS_PREFIX + "/" + productId + "/" + MODEL_FILENAME;
    }

    private String requireSafeSegment(String productId) {
        if (productId == null || productId.isBlank()
                || productId.contains("/") || productId.contains("\\") || productId.contains("..")) {
            throw new AssetDownloadException("Invalid product id for asset storage: " + productId);
        }
        return productId;
    }
}
