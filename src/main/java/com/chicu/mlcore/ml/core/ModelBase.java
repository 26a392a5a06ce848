package com.chicu.mlcore.ml.core;

import com.chicu.mlcore.common.enums.ArtifactType;
import com.chicu.mlcore.common.enums.ModelStatus;
import com.chicu.mlcore.ml.error.ErrorCode;
import com.chicu.mlcore.ml.error.LifecycleException;
import com.chicu.mlcore.ml.error.ModelException;
import com.chicu.mlcore.ml.error.PersistenceException;
import com.chicu.mlcore.ml.error.PredictionException;
import com.chicu.mlcore.ml.error.TrainingException;
import com.chicu.mlcore.ml.error.ValidationException;
import com.chicu.mlcore.ml.lifecycle.LifecycleContext;
import com.chicu.mlcore.ml.lifecycle.LifecycleHooks;
import com.chicu.mlcore.ml.lifecycle.LifecycleOperation;
import com.chicu.mlcore.ml.persistence.ArtifactSpec;
import com.chicu.mlcore.ml.persistence.ModelKeyFactory;
import com.chicu.mlcore.ml.persistence.ModelManifest;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * ModelBase
 * =========
 * Общий контракт train / predict / evaluate / save / load для всех обёрток моделей.
 * <p>
 * Обёртка знает только алгоритм (fit / infer) и какие у неё слоты состояния
 * ({@link #registerArtifact}); манифест, статусы, хуки и диск — здесь.
 * <p>
 * Статусы: initialized → training → trained | failed; trained → training при переобучении;
 * failed не терминальный.
 * <p>
 * Экземпляр не потокобезопасен: вызовы train/predict/save/load на одном экземпляре
 * сериализует вызывающий код.
 *
 * @param <I> вход (матрица, ряд, журнал событий)
 * @param <P> одна запись предсказания
 * @param <L> разметка для evaluate
 */
@Slf4j
public abstract class ModelBase<I, P, L> {

    private final ModelRuntime runtime;
    private final List<LifecycleHooks> hooks = new ArrayList<>();
    private final Map<String, ArtifactBinding<?, ?>> artifactBindings = new LinkedHashMap<>();

    private ModelManifest manifest;
    private boolean trained;

    protected ModelBase(ModelRuntime runtime, String modelId, String modelType, String version) {
        if (runtime == null) throw new IllegalArgumentException("runtime=null");
        if (modelId == null || modelId.isBlank()) throw new IllegalArgumentException("modelId пустой");
        if (modelType == null || modelType.isBlank()) throw new IllegalArgumentException("modelType пустой");
        if (version == null || version.isBlank()) throw new IllegalArgumentException("version пустой");

        this.runtime = runtime;
        this.hooks.addAll(runtime.hooks());
        this.manifest = ModelManifest.builder()
                .schemaVersion(runtime.schemaVersion())
                .modelId(modelId.trim())
                .modelType(modelType.trim())
                .version(version.trim())
                .createdAt(Instant.now())
                .status(ModelStatus.INITIALIZED)
                .build();
    }

    // =====================================================================
    // Контракт обёртки
    // =====================================================================

    /** Минимальное число обучающих сэмплов; проверяется до вызова внешней библиотеки. */
    protected abstract int minTrainingSamples();

    protected abstract int sampleCount(I data);

    /**
     * Обучение через внешнюю библиотеку.
     *
     * @return метрики обучения (training_samples добавляется автоматически)
     */
    protected abstract Map<String, Double> fit(I data);

    protected abstract PredictionResult<P> infer(I data);

    public abstract Map<String, Double> evaluate(I data, L labels);

    /** Классы внешних библиотек, без которых fit невозможен. */
    protected List<String> requiredDependencies() {
        return List.of();
    }

    /** Версия входной схемы после обучения (например hash FeatureSchema). */
    protected String inputSchemaVersion() {
        return null;
    }

    /** Вызывается после того, как все артефакты разложены по слотам при load(). */
    protected void onRestored() {
    }

    protected final <T> void registerArtifact(String name,
                                              String filename,
                                              ArtifactType type,
                                              Class<T> valueType,
                                              Supplier<T> producer,
                                              Consumer<T> restorer) {
        registerArtifact(name, filename, type, valueType, producer, Function.identity(), restorer);
    }

    /**
     * Слот с преобразованием при загрузке: converter вызывается для всех артефактов
     * до первого restorer, так что падение converter не оставляет модель наполовину загруженной.
     */
    protected final <T, S> void registerArtifact(String name,
                                                 String filename,
                                                 ArtifactType type,
                                                 Class<T> valueType,
                                                 Supplier<T> producer,
                                                 Function<T, S> converter,
                                                 Consumer<S> restorer) {
        if (artifactBindings.containsKey(name)) {
            throw new IllegalStateException("Артефакт уже зарегистрирован: " + name);
        }
        artifactBindings.put(name, new ArtifactBinding<>(name, filename, type, valueType, producer, converter, restorer));
    }

    protected final void hyperparameter(String key, Object value) {
        manifest.getHyperparameters().put(key, value);
    }

    protected final void dependency(String library, String version) {
        manifest.getDependencies().put(library, version);
    }

    /** Implementation-Version из MANIFEST.MF библиотеки; "unknown", если jar его не пишет. */
    protected static String libraryVersion(Class<?> libraryClass) {
        Package p = libraryClass.getPackage();
        String v = p != null ? p.getImplementationVersion() : null;
        return v != null ? v : "unknown";
    }

    public final ModelBase<I, P, L> addHooks(LifecycleHooks... extra) {
        hooks.addAll(Arrays.asList(extra));
        return this;
    }

    // =====================================================================
    // train
    // =====================================================================

    public final TrainingResult train(I data) {
        LifecycleContext ctx = context(LifecycleOperation.TRAIN)
                .with("previous_status", manifest.getStatus().wireName());

        fire(ctx, LifecycleHooks::beforeTrain, "before_train");
        checkTrainingPreconditions(data);

        manifest.setStatus(ModelStatus.TRAINING);

        int samples;
        Map<String, Double> metrics = new LinkedHashMap<>();
        String schemaVersion;
        try {
            samples = sampleCount(data);
            Map<String, Double> fitted = fit(data);
            metrics.put("training_samples", (double) samples);
            if (fitted != null) {
                metrics.putAll(fitted);
            }
            schemaVersion = inputSchemaVersion();
        } catch (RuntimeException e) {
            TrainingException failure = asTrainingFailure(e);
            markFailed(ctx, failure);
            throw failure;
        } catch (Error e) {
            // Error из библиотеки не оборачиваем, но статус и rollback те же
            TrainingException failure = new TrainingException(
                    "Ошибка обучения: " + e,
                    Map.of("model_id", manifest.getModelId(), "model_type", manifest.getModelType(),
                            "cause", e.getClass().getName()),
                    e
            );
            markFailed(ctx, failure);
            throw e;
        }

        manifest.setTrainingSamples(samples);
        manifest.setPerformanceMetrics(new LinkedHashMap<>(metrics));
        manifest.setTrainedAt(Instant.now());
        manifest.setInputSchemaVersion(schemaVersion);
        manifest.setStatus(ModelStatus.TRAINED);
        trained = true;

        fire(ctx.with("training_samples", samples), LifecycleHooks::afterTrain, "after_train");

        return TrainingResult.ok(Collections.unmodifiableMap(metrics), manifest.copy());
    }

    private void markFailed(LifecycleContext ctx, TrainingException failure) {
        manifest.setStatus(ModelStatus.FAILED);
        trained = false;
        rollback(ctx, failure);
        log.warn("❌ TRAIN FAIL {} err={}", fingerprint(), failure.toString());
    }

    private void checkTrainingPreconditions(I data) {
        if (data == null) {
            throw new TrainingException("data=null", Map.of("model_id", manifest.getModelId()));
        }

        for (String className : requiredDependencies()) {
            try {
                Class.forName(className, false, getClass().getClassLoader());
            } catch (ClassNotFoundException | LinkageError e) {
                throw new TrainingException(
                        "Зависимость недоступна: " + className,
                        Map.of("model_id", manifest.getModelId(), "dependency", className),
                        e
                );
            }
        }

        int samples;
        try {
            samples = sampleCount(data);
        } catch (RuntimeException e) {
            throw asTrainingFailure(e);
        }
        int required = minTrainingSamples();
        if (samples < required) {
            throw new TrainingException(
                    "Недостаточно данных: нужно минимум " + required + " сэмплов, получено " + samples,
                    Map.of("model_id", manifest.getModelId(), "samples", samples, "required", required)
            );
        }
    }

    private TrainingException asTrainingFailure(RuntimeException e) {
        if (e instanceof TrainingException te) {
            return te;
        }
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("model_id", manifest.getModelId());
        ctx.put("model_type", manifest.getModelType());
        ctx.put("cause", String.valueOf(e.getMessage()));
        if (e instanceof ModelException me) {
            ctx.put("cause_code", me.getCode().name());
        }
        return new TrainingException("Ошибка обучения: " + e.getMessage(), ctx, e);
    }

    // =====================================================================
    // predict
    // =====================================================================

    public final PredictionResult<P> predict(I data) {
        if (!trained) {
            throw new PredictionException(
                    "Модель не обучена",
                    Map.of("model_id", manifest.getModelId(), "status", manifest.getStatus().wireName())
            );
        }

        LifecycleContext ctx = context(LifecycleOperation.PREDICT);
        fire(ctx, LifecycleHooks::beforePredict, "before_predict");

        PredictionResult<P> result;
        try {
            if (data == null) {
                throw new PredictionException("data=null", Map.of("model_id", manifest.getModelId()));
            }
            result = infer(data);
        } catch (RuntimeException e) {
            if (e instanceof PredictionException pe) {
                throw pe;
            }
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("model_id", manifest.getModelId());
            c.put("cause", String.valueOf(e.getMessage()));
            if (e instanceof ModelException me) {
                c.put("cause_code", me.getCode().name());
            }
            throw new PredictionException("Ошибка предсказания: " + e.getMessage(), c, e);
        }

        fire(ctx.with("predictions", result.size()), LifecycleHooks::afterPredict, "after_predict");
        return result;
    }

    // =====================================================================
    // save
    // =====================================================================

    public final Path save() {
        return save(null);
    }

    /**
     * Пишет все артефакты и manifest.json.
     * <p>
     * Не атомарно: падение между файлами оставит сироты на диске, читатель защищён checksum'ами.
     * При ошибке вызывающий код повторяет save() целиком.
     *
     * @param directory каталог версии; null → &lt;root&gt;/&lt;type&gt;/&lt;id&gt;/&lt;version&gt;
     * @return каталог, куда сохранена модель
     */
    public final Path save(Path directory) {
        if (!trained) {
            throw new PersistenceException(
                    "Нельзя сохранить необученную модель",
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("model_id", manifest.getModelId(), "status", manifest.getStatus().wireName())
            );
        }

        Path dir = directory != null ? directory : defaultDirectory();
        LifecycleContext ctx = context(LifecycleOperation.SAVE).with("path", dir.toString());

        fire(ctx, LifecycleHooks::beforeSave, "before_save");

        try {
            Path artifactsDir = ModelKeyFactory.artifactsDir(dir);
            List<ArtifactSpec> specs = new ArrayList<>(artifactBindings.size());

            for (ArtifactBinding<?, ?> binding : artifactBindings.values()) {
                Object value = binding.produce();
                if (value == null) {
                    throw new PersistenceException(
                            "Слот артефакта пуст: " + binding.name(),
                            ErrorCode.MISSING_ARTIFACT,
                            Map.of("model_id", manifest.getModelId(), "artifact", binding.name())
                    );
                }
                specs.add(runtime.artifactStore().save(
                        value, artifactsDir.resolve(binding.filename()), binding.type(), binding.name()));
            }

            // список заменяется целиком: повторные save() не копят дубликаты
            manifest.setArtifacts(specs);
            manifest.setSchemaVersion(runtime.schemaVersion());
            runtime.manifestCodec().write(manifest, ModelKeyFactory.manifestFile(dir));
        } catch (RuntimeException e) {
            ModelException failure = e instanceof ModelException me
                    ? me
                    : new PersistenceException(
                            "Ошибка сохранения: " + e.getMessage(),
                            ErrorCode.PERSISTENCE_ERROR,
                            Map.of("model_id", manifest.getModelId(), "path", dir.toString(),
                                    "cause", String.valueOf(e.getMessage())),
                            e
                    );
            rollback(ctx, failure);
            log.warn("❌ SAVE FAIL {} path={} err={}", fingerprint(), dir, failure.toString());
            throw failure;
        }

        fire(ctx.with("artifacts", manifest.getArtifacts().size()), LifecycleHooks::afterSave, "after_save");
        return dir;
    }

    // =====================================================================
    // load
    // =====================================================================

    /**
     * Читает manifest.json, проверяет его (поля, версия схемы, checksum каждого файла),
     * раскладывает артефакты по слотам. Частичной загрузки нет.
     */
    public final void load(Path directory) {
        if (directory == null) {
            throw new ValidationException("directory=null", Map.of("model_id", manifest.getModelId()));
        }

        ModelManifest loaded;
        try {
            loaded = runtime.manifestCodec().read(ModelKeyFactory.manifestFile(directory));
            Path artifactsDir = ModelKeyFactory.artifactsDir(directory);

            runtime.manifestValidator().validate(loaded, artifactsDir);

            if (!manifest.getModelType().equals(loaded.getModelType())) {
                throw new ValidationException(
                        "Тип модели в манифесте не совпадает: " + loaded.getModelType(),
                        Map.of("expected", manifest.getModelType(), "actual", loaded.getModelType())
                );
            }

            Map<String, Object> staged = new LinkedHashMap<>();
            for (ArtifactSpec spec : loaded.getArtifacts()) {
                ArtifactBinding<?, ?> binding = artifactBindings.get(spec.name());
                if (binding == null) {
                    log.warn("⚠️ Artifact {} не известен модели {}, пропускаю", spec.name(), manifest.getModelType());
                    continue;
                }
                if (binding.type() != spec.artifactType()) {
                    throw new ValidationException(
                            "Тип артефакта " + spec.name() + " не совпадает: " + spec.artifactType(),
                            Map.of("artifact", spec.name(), "expected", binding.type(), "actual", spec.artifactType())
                    );
                }
                Object raw = runtime.artifactStore().load(
                        artifactsDir.resolve(spec.filename()), spec.artifactType(), binding.valueType());
                staged.put(spec.name(), binding.convert(raw));
            }

            List<String> missing = new ArrayList<>();
            for (String name : artifactBindings.keySet()) {
                if (!staged.containsKey(name)) missing.add(name);
            }
            if (!missing.isEmpty()) {
                throw new PersistenceException(
                        "В манифесте нет обязательных артефактов: " + missing,
                        ErrorCode.MISSING_ARTIFACT,
                        Map.of("model_id", loaded.getModelId(), "missing_artifacts", List.copyOf(missing))
                );
            }

            // все значения уже преобразованы, дальше только присваивания
            staged.forEach((name, value) -> artifactBindings.get(name).restore(value));
            onRestored();
        } catch (RuntimeException e) {
            if (e instanceof ModelException me) {
                log.warn("❌ LOAD FAIL path={} err={}", directory, me.toString());
                throw me;
            }
            throw new PersistenceException(
                    "Ошибка загрузки: " + e.getMessage(),
                    ErrorCode.PERSISTENCE_ERROR,
                    Map.of("path", directory.toString(), "cause", String.valueOf(e.getMessage())),
                    e
            );
        }

        this.manifest = loaded;
        this.trained = true;

        LifecycleContext ctx = context(LifecycleOperation.LOAD)
                .with("path", directory.toString())
                .with("version", loaded.getVersion());
        fire(ctx, LifecycleHooks::afterLoad, "after_load");
    }

    // =====================================================================
    // Версии
    // =====================================================================

    /**
     * Начать новую версию: живой манифест заменяется новым (initialized),
     * старый объект манифеста не трогается. Гиперпараметры и зависимости переносятся.
     */
    public final void supersede(String newVersion) {
        if (newVersion == null || newVersion.isBlank()) {
            throw new IllegalArgumentException("newVersion пустой");
        }
        ModelManifest previous = manifest;
        this.manifest = ModelManifest.builder()
                .schemaVersion(runtime.schemaVersion())
                .modelId(previous.getModelId())
                .modelType(previous.getModelType())
                .version(newVersion.trim())
                .createdAt(Instant.now())
                .status(ModelStatus.INITIALIZED)
                .hyperparameters(new LinkedHashMap<>(previous.getHyperparameters()))
                .dependencies(new LinkedHashMap<>(previous.getDependencies()))
                .build();
        this.trained = false;
        log.info("🆕 New version {} supersedes {}", fingerprint(), previous.getVersion());
    }

    // =====================================================================
    // Доступ
    // =====================================================================

    public String getModelId() {
        return manifest.getModelId();
    }

    public String getModelType() {
        return manifest.getModelType();
    }

    public String getVersion() {
        return manifest.getVersion();
    }

    public ModelStatus getStatus() {
        return manifest.getStatus();
    }

    public boolean isTrained() {
        return trained;
    }

    /** Снимок манифеста; живой манифест наружу не отдаётся. */
    public ModelManifest manifest() {
        return manifest.copy();
    }

    public String fingerprint() {
        return ModelKeyFactory.fingerprint(manifest);
    }

    public Path defaultDirectory() {
        return ModelKeyFactory.versionDir(runtime.modelsRoot(), getModelType(), getModelId(), getVersion());
    }

    public Map<String, Object> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("model_id", getModelId());
        info.put("model_type", getModelType());
        info.put("version", getVersion());
        info.put("is_trained", trained);
        info.put("status", getStatus().wireName());
        info.put("performance_metrics", Map.copyOf(manifest.getPerformanceMetrics()));
        info.put("hyperparameters", Collections.unmodifiableMap(new LinkedHashMap<>(manifest.getHyperparameters())));
        return info;
    }

    /** Дописать метрики оценки в живой манифест (попадут в следующий save). */
    protected final void recordMetrics(Map<String, Double> metrics) {
        manifest.getPerformanceMetrics().putAll(metrics);
    }

    // =====================================================================
    // Хуки
    // =====================================================================

    private LifecycleContext context(LifecycleOperation operation) {
        return LifecycleContext.of(manifest.getModelId(), manifest.getModelType(), operation);
    }

    private void fire(LifecycleContext ctx, BiConsumer<LifecycleHooks, LifecycleContext> point, String pointName) {
        for (LifecycleHooks hook : hooks) {
            try {
                point.accept(hook, ctx);
            } catch (LifecycleException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new LifecycleException(
                        "Хук " + pointName + " упал: " + e.getMessage(),
                        Map.of(
                                "hook", pointName,
                                "hook_class", hook.getClass().getName(),
                                "model_id", manifest.getModelId(),
                                "cause", String.valueOf(e.getMessage())
                        ),
                        e
                );
            }
        }
    }

    private void rollback(LifecycleContext ctx, ModelException failure) {
        LifecycleContext rc = ctx
                .with("error", String.valueOf(failure.getMessage()))
                .with("error_code", failure.getCode().name());
        for (LifecycleHooks hook : hooks) {
            try {
                hook.onRollback(rc);
            } catch (RuntimeException e) {
                failure.addSuppressed(e);
            }
        }
    }
}
