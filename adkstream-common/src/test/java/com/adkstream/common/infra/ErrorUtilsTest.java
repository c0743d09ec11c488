package com.adkstream.common.infra;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ErrorUtilsTest {

    @Test
    void formatErrorMessage_unwrapsCompletionException() {
        var err = new CompletionException(new IOException("socket closed"));
        assertEquals("socket closed", ErrorUtils.formatErrorMessage(err));
    }

    @Test
    void formatErrorMessage_noMessage_usesClassName() {
        assertEquals("IllegalStateException", ErrorUtils.formatErrorMessage(new IllegalStateException()));
    }

    @Test
    void formatErrorMessage_null_isGeneric() {
        assertEquals("Error", ErrorUtils.formatErrorMessage(null));
    }
}
