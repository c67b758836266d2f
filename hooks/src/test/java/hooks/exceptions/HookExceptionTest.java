package hooks.exceptions;

import hooks.phase.Operation;
import hooks.phase.PhaseIdentifier;
import hooks.result.FailureReason;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HookExceptionTest {

    @Test
    void messageWithoutContext() {
        HookException e = new HookException("boom");

        assertEquals("boom", e.getMessage());
        assertNull(e.getOperation());
        assertNull(e.getReason());
    }

    @Test
    void messageWithFullContext() {
        HookException e = new HookException("exit code 1", Operation.ROLLBACK, PhaseIdentifier.PRE_ROLLBACK,
                "Job/restore", FailureReason.HOOK_FAILED, null);

        assertEquals("exit code 1 [operation=rollback] [phase=pre-rollback] [hook=Job/restore] [reason=HOOK_FAILED]",
                e.getMessage());
    }

    @Test
    void unrecognizedPhaseNamesManifestAndValue() {
        UnrecognizedPhaseException e = new UnrecognizedPhaseException("chart/templates/job.yaml", "pre-instal");

        assertEquals("chart/templates/job.yaml", e.getManifest());
        assertEquals("pre-instal", e.getValue());
        assertEquals(FailureReason.UNRECOGNIZED_PHASE, e.getReason());
        assertTrue(e.getMessage().startsWith("Unrecognized hook phase 'pre-instal' on manifest chart/templates/job.yaml"));
    }

    @Test
    void readinessTimeoutMessage() {
        ReadinessTimeoutException e = new ReadinessTimeoutException("Job/migrate", Duration.ofSeconds(2));

        assertEquals("Hook 'Job/migrate' not ready after 2000 ms", e.getMessage());
        assertEquals(Duration.ofSeconds(2), e.getTimeout());
    }

    @Test
    void unknownOperationMessage() {
        assertEquals("Unknown release operation: promote", new UnknownOperationException("promote").getMessage());
    }
}
