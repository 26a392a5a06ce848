package com.chicu.mlcore.ml.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Структурированный лог по каждой точке жизненного цикла.
 */
@Slf4j
@Component
public class LoggingLifecycleHooks implements LifecycleHooks {

    @Override
    public void beforeTrain(LifecycleContext ctx) {
        log.info("🧠 TRAIN start modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void afterTrain(LifecycleContext ctx) {
        log.info("🧠 TRAIN OK modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void beforePredict(LifecycleContext ctx) {
        log.debug("🔮 PREDICT start modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void afterPredict(LifecycleContext ctx) {
        log.debug("🔮 PREDICT OK modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void beforeSave(LifecycleContext ctx) {
        log.debug("💾 SAVE start modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void afterSave(LifecycleContext ctx) {
        log.info("💾 SAVE OK modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void afterLoad(LifecycleContext ctx) {
        log.info("📦 LOAD OK modelType={} modelId={} payload={}", ctx.modelType(), ctx.modelId(), ctx.payload());
    }

    @Override
    public void onRollback(LifecycleContext ctx) {
        log.warn("↩️ ROLLBACK modelType={} modelId={} op={} payload={}",
                ctx.modelType(), ctx.modelId(), ctx.operation(), ctx.payload());
    }
}
