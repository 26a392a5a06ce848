package com.chicu.mlcore.ml.forecast;

/** Как заполнять пропуски (NaN) во временном ряду */
public enum FillMethod {
    FORWARD_FILL,
    BACKWARD_FILL,
    MEAN,
    ZERO
}
