package com.chicu.mlcore.ml.core;

import com.chicu.mlcore.common.enums.ArtifactType;

import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Именованный слот состояния модели: как его достать для save() и куда положить при load().
 * <p>
 * Загрузка в две фазы: {@link #convert} (может упасть) и {@link #restore} (только присваивание).
 *
 * @param <T> тип, который пишет/читает ArtifactStore
 * @param <S> тип, который хранит модель
 */
public record ArtifactBinding<T, S>(
        String name,
        String filename,
        ArtifactType type,
        Class<T> valueType,
        Supplier<T> producer,
        Function<T, S> converter,
        Consumer<S> restorer
) {

    Object produce() {
        return producer.get();
    }

    Object convert(Object raw) {
        return converter.apply(valueType.cast(raw));
    }

    @SuppressWarnings("unchecked")
    void restore(Object converted) {
        restorer.accept((S) converted);
    }
}
