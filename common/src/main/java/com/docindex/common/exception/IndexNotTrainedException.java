package com.docindex.common.exception;

/**
 * A vector was offered to a clustered index before its training step ran.
 */
public class IndexNotTrainedException extends DocIndexException {

    public IndexNotTrainedException(String message) {
        super(message);
    }
}
