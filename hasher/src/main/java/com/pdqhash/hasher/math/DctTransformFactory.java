package com.pdqhash.hasher.math;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DctTransformFactory {

    private static final Logger logger = LoggerFactory.getLogger(DctTransformFactory.class);

    public static DctTransform create(String name, DctBasis basis) {
        String kind = name;

        if (kind == null || kind.trim().isEmpty()) {
            logger.warn("DCT transform not specified, defaulting to '{}'", MatrixDctTransform.NAME);
            kind = MatrixDctTransform.NAME;
        }

        switch (kind.trim().toLowerCase()) {
            case MatrixDctTransform.NAME:
                return new MatrixDctTransform(basis);
            case UnrolledDctTransform.NAME:
                return new UnrolledDctTransform(basis);
            default:
                logger.warn("Unknown DCT transform '{}', defaulting to '{}'", name, MatrixDctTransform.NAME);
                return new MatrixDctTransform(basis);
        }
    }
}
