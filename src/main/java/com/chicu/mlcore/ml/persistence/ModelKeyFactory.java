package com.chicu.mlcore.ml.persistence;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Fingerprint модели и раскладка каталогов хранилища.
 * <p>
 * Пример ключа: dbscan|orders_detector|1.0.0
 * Пример пути:  &lt;root&gt;/dbscan/orders_detector/1.0.0
 */
public final class ModelKeyFactory {

    public static final String ARTIFACTS_DIR = "artifacts";

    private ModelKeyFactory() {
    }

    public static String fingerprint(String modelType, String modelId, String version) {
        return norm(modelType) + "|" + norm(modelId) + "|" + norm(version);
    }

    public static String fingerprint(ModelManifest manifest) {
        return fingerprint(manifest.getModelType(), manifest.getModelId(), manifest.getVersion());
    }

    public static Path versionDir(Path root, String modelType, String modelId, String version) {
        return root.resolve(segment(modelType)).resolve(segment(modelId)).resolve(segment(version));
    }

    public static Path artifactsDir(Path versionDir) {
        return versionDir.resolve(ARTIFACTS_DIR);
    }

    public static Path manifestFile(Path versionDir) {
        return versionDir.resolve(ManifestCodec.MANIFEST_FILE);
    }

    private static String norm(String s) {
        if (s == null) return "NULL";
        String x = s.trim().toLowerCase(Locale.ROOT);
        return x.isEmpty() ? "NULL" : x;
    }

    private static String segment(String s) {
        if (s == null || s.isBlank()) {
            throw new IllegalArgumentException("path segment пустой");
        }
        String x = s.trim();
        if (x.contains("/") || x.contains("\\") || x.equals("..") || x.equals(".")) {
            throw new IllegalArgumentException("недопустимый сегмент пути: " + s);
        }
        return x;
    }
}
