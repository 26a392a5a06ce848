package com.chicu.mlcore.ml.persistence;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * ArtifactStore
 * =============
 * Пишет/читает непрозрачные объекты модели на диск и считает контрольные суммы.
 * <p>
 * Стратегия сериализации выбирается только по {@link ArtifactType}:
 * - NATIVE  → ObjectOutputStream (объект обязан быть Serializable)
 * - TABULAR → double[][] построчно в CSV
 * - JSON    → Jackson
 * - BINARY  → double[] как big-endian IEEE-754
 * <p>
 * Только синхронный дисковый I/O.
 */
@Slf4j
@RequiredArgsConstructor
public class ArtifactStore {

    private static final String CSV_SEPARATOR = ",";

    private final ObjectMapper objectMapper;

    public ArtifactSpec save(Object value, Path destination, ArtifactType type) {
        return save(value, destination, type, null);
    }

    /**
     * @param name имя артефакта; если не задано — stem имени файла
     */
    public ArtifactSpec save(Object value, Path destination, ArtifactType type, String name) {
        if (destination == null) {
            throw new ValidationException("destination=null");
        }
        if (type == null) {
            throw new ValidationException("artifactType=null", Map.of("path", destination.toString()));
        }
        if (value == null) {
            throw new ValidationException("artifact value is null", Map.of("path", destination.toString(), "artifact_type", type));
        }

        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            switch (type) {
                case NATIVE -> writeNative(value, destination);
                case TABULAR -> writeTabular(value, destination);
                case JSON -> objectMapper.writeValue(destination.toFile(), value);
                case BINARY -> writeBinary(value, destination);
            }

            String checksum = Checksums.sha256(destination);
            long size = Files.size(destination);
            String artifactName = (name == null || name.isBlank()) ? stem(destination) : name;

            log.debug("💾 Artifact saved: name={} type={} file={} size={} sha256={}",
                    artifactName, type, destination.getFileName(), size, checksum);

            return new ArtifactSpec(artifactName, destination.getFileName().toString(), checksum, size, type);
        } catch (IOException e) {
            throw new PersistenceException(
                    "Не удалось записать артефакт " + destination.getFileName() + ": " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", destination.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }
    }

    public Object load(Path path, ArtifactType type) {
        if (path == null) {
            throw new ValidationException("path=null");
        }
        if (type == null) {
            throw new ValidationException("artifactType=null", Map.of("path", path.toString()));
        }
        requireExists(path);

        try {
            return switch (type) {
                case NATIVE -> readNative(path);
                case TABULAR -> readTabular(path);
                case JSON -> objectMapper.readTree(path.toFile());
                case BINARY -> readBinary(path);
            };
        } catch (IOException | ClassNotFoundException e) {
            throw readFailure(path, e);
        }
    }

    /**
     * Типизированная загрузка. Для JSON объект собирается Jackson'ом сразу в нужный класс,
     * для остальных типов результат проверяется на совместимость.
     */
    public <T> T load(Path path, ArtifactType type, Class<T> valueType) {
        if (type == ArtifactType.JSON && valueType != null) {
            requireExists(path);
            try {
                return objectMapper.readValue(path.toFile(), valueType);
            } catch (IOException e) {
                throw readFailure(path, e);
            }
        }

        Object raw = load(path, type);
        if (valueType != null && !valueType.isInstance(raw)) {
            throw new ValidationException(
                    "Артефакт " + path.getFileName() + " имеет тип " + raw.getClass().getSimpleName()
                            + ", ожидался " + valueType.getSimpleName(),
                    Map.of("path", path.toString(), "artifact_type", type)
            );
        }
        return valueType == null ? null : valueType.cast(raw);
    }

    // ------------------------------------------------------------------
    // NATIVE
    // ------------------------------------------------------------------

    private static void writeNative(Object value, Path destination) throws IOException {
        if (!(value instanceof Serializable)) {
            throw new ValidationException(
                    "NATIVE артефакт должен быть Serializable: " + value.getClass().getName(),
                    Map.of("path", destination.toString())
            );
        }
        try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(destination));
             ObjectOutputStream out = new ObjectOutputStream(os)) {
            out.writeObject(value);
        }
    }

    private static Object readNative(Path path) throws IOException, ClassNotFoundException {
        try (InputStream is = Files.newInputStream(path);
             ObjectInputStream in = new ObjectInputStream(is)) {
            return in.readObject();
        }
    }

    // ------------------------------------------------------------------
    // TABULAR
    // ------------------------------------------------------------------

    private static void writeTabular(Object value, Path destination) throws IOException {
        if (!(value instanceof double[][] rows)) {
            throw new ValidationException(
                    "TABULAR артефакт должен быть double[][]: " + value.getClass().getName(),
                    Map.of("path", destination.toString())
            );
        }
        try (BufferedWriter w = Files.newBufferedWriter(destination, StandardCharsets.UTF_8)) {
            for (double[] row : rows) {
                StringBuilder sb = new StringBuilder();
                for (int i = 0; i < row.length; i++) {
                    if (i > 0) sb.append(CSV_SEPARATOR);
                    sb.append(Double.toString(row[i]));
                }
                w.write(sb.toString());
                w.newLine();
            }
        }
    }

    private static double[][] readTabular(Path path) throws IOException {
        List<double[]> rows = new ArrayList<>();
        try (BufferedReader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) continue;
                String[] cells = line.split(CSV_SEPARATOR, -1);
                double[] row = new double[cells.length];
                for (int i = 0; i < cells.length; i++) {
                    try {
                        row[i] = Double.parseDouble(cells[i].trim());
                    } catch (NumberFormatException e) {
                        throw new IOException("bad number at line " + lineNo + " col " + (i + 1) + ": " + cells[i], e);
                    }
                }
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    // ------------------------------------------------------------------
    // BINARY
    // ------------------------------------------------------------------

    private static void writeBinary(Object value, Path destination) throws IOException {
        if (!(value instanceof double[] weights)) {
            throw new ValidationException(
                    "BINARY артефакт должен быть double[]: " + value.getClass().getName(),
                    Map.of("path", destination.toString())
            );
        }
        ByteBuffer buf = ByteBuffer.allocate(weights.length * Double.BYTES);
        buf.asDoubleBuffer().put(weights);
        Files.write(destination, buf.array());
    }

    private static double[] readBinary(Path path) throws IOException {
        byte[] bytes = Files.readAllBytes(path);
        if (bytes.length % Double.BYTES != 0) {
            throw new IOException("binary artifact size " + bytes.length + " is not a multiple of " + Double.BYTES);
        }
        DoubleBuffer db = ByteBuffer.wrap(bytes).asDoubleBuffer();
        double[] out = new double[db.remaining()];
        db.get(out);
        return out;
    }

    // ------------------------------------------------------------------

    private static String stem(Path file) {
        String fn = file.getFileName().toString();
        int dot = fn.lastIndexOf('.');
        return dot > 0 ? fn.substring(0, dot) : fn;
    }

    private static void requireExists(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new PersistenceException(
                    "Артефакт не найден: " + path,
                    ErrorCode.MISSING_ARTIFACT,
                    Map.of("path", path.toString())
            );
        }
    }

    private static PersistenceException readFailure(Path path, Exception e) {
        return new PersistenceException(
                "Не удалось прочитать артефакт " + path.getFileName() + ": " + e.getMessage(),
                ErrorCode.PERSISTENCE_ERROR,
                Map.of("path", path.toString(), "cause", String.valueOf(e.getMessage())),
                e
        );
    }
}
