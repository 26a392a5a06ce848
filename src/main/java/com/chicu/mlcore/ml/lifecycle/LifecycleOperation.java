package com.chicu.mlcore.ml.lifecycle;

public enum LifecycleOperation {
    TRAIN,
    PREDICT,
    SAVE,
    LOAD
}
