package com.chicu.mlcore.ml.features;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Кодирование категорий без зависимости от порядка данных и seed'а:
 * известные категории → индекс в отсортированном списке, новые → md5 % maxCategories.
 */
@Getter
@NoArgsConstructor
public class DeterministicEncoder {

    public static final int DEFAULT_MAX_CATEGORIES = 1000;

    @JsonProperty("max_categories")
    private int maxCategories = DEFAULT_MAX_CATEGORIES;

    @JsonProperty("category_mappings")
    private Map<String, Integer> categoryMappings = new TreeMap<>();

    @JsonProperty("is_fitted")
    private boolean fitted;

    public DeterministicEncoder(int maxCategories) {
        if (maxCategories <= 0) {
            throw new IllegalArgumentException("maxCategories должен быть > 0");
        }
        this.maxCategories = maxCategories;
    }

    public DeterministicEncoder fit(Collection<String> categories) {
        Map<String, Integer> mappings = new TreeMap<>();
        int idx = 0;
        for (String c : new TreeSet<>(categories)) {
            mappings.put(c, idx++ % maxCategories);
        }
        this.categoryMappings = mappings;
        this.fitted = true;
        return this;
    }

    public int encode(String category) {
        if (!fitted) {
            throw new IllegalStateException("Encoder не обучен");
        }
        Integer code = categoryMappings.get(category);
        return code != null ? code : hashBucket(category, maxCategories);
    }

    static int hashBucket(String category, int modulo) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(category.getBytes(StandardCharsets.UTF_8));
            return new BigInteger(1, digest).mod(BigInteger.valueOf(modulo)).intValue();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("md5 недоступен", e);
        }
    }
}
