package com.ryuqq.taskbridge.core.outcome;

import com.ryuqq.taskbridge.core.error.ErrorKind;
import com.ryuqq.taskbridge.core.error.PasswordRequiredException;
import com.ryuqq.taskbridge.core.error.TransientProtocolException;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Fail Record 테스트.
 *
 * @author TaskBridge Team
 * @since 1.0.0
 */
class FailTest {

    @Test
    void constructor_NullKind_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new Fail(null, "message", null)
        );
        assertTrue(exception.getMessage().contains("kind cannot be null"));
    }

    @Test
    void constructor_BlankMessage_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new Fail(ErrorKind.FATAL_PROTOCOL, " ", null));
    }

    @Test
    void from_TransientException_KeepsKindAndCause() {
        // Given
        TransientProtocolException exception =
            new TransientProtocolException("connection reset", new IOException("peer closed"));

        // When
        Fail fail = Fail.from(exception);

        // Then
        assertEquals(ErrorKind.TRANSIENT_PROTOCOL, fail.kind());
        assertEquals("connection reset", fail.message());
        assertTrue(fail.cause().contains("IOException"));
    }

    @Test
    void from_PasswordRequired_IsFatal() {
        Fail fail = Fail.from(new PasswordRequiredException());

        assertEquals(ErrorKind.FATAL_PROTOCOL, fail.kind());
        assertFalse(fail.kind().isRetryable());
    }

    @Test
    void unexpected_MapsToInternalInvariant() {
        Fail fail = Fail.unexpected(new NullPointerException());

        assertEquals(ErrorKind.INTERNAL_INVARIANT, fail.kind());
        assertTrue(fail.message().contains("NullPointerException"));
    }

    @Test
    void outcome_TypeChecks() {
        Outcome ok = Ok.of("v");
        Outcome fail = Fail.of(ErrorKind.VALIDATION, "bad");
        Outcome cancelled = Cancelled.requested();

        assertTrue(ok.isOk());
        assertTrue(fail.isFail());
        assertTrue(cancelled.isCancelled());
        assertSame(Ok.empty(), Ok.of(null));
    }
}
