package com.chicu.mlcore.ml.lifecycle;

/**
 * Точки расширения вокруг train/predict/save/load.
 * <p>
 * Порядок вызова:
 * beforeTrain → fit → afterTrain;
 * beforePredict → infer → afterPredict;
 * beforeSave → persist → afterSave;
 * restore → afterLoad.
 * onRollback — для компенсирующих действий после неудачного train/save.
 * <p>
 * Исключение из хука оборачивается в LifecycleException и прерывает операцию
 * до её основного побочного эффекта. Контекст менять нельзя (он и так immutable).
 */
public interface LifecycleHooks {

    default void beforeTrain(LifecycleContext context) {
    }

    default void afterTrain(LifecycleContext context) {
    }

    default void beforePredict(LifecycleContext context) {
    }

    default void afterPredict(LifecycleContext context) {
    }

    default void beforeSave(LifecycleContext context) {
    }

    default void afterSave(LifecycleContext context) {
    }

    default void afterLoad(LifecycleContext context) {
    }

    default void onRollback(LifecycleContext context) {
    }
}
