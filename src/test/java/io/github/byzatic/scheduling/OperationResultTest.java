package io.github.byzatic.scheduling;

import io.github.byzatic.scheduling.base_exceptions.ScheduledEntityNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class OperationResultTest {

    @Test
    void success_carriesValueAndMessages() {
        OperationResult<String> r = OperationResult.success("v", "done");
        assertTrue(r.isSuccess());
        assertFalse(r.isFailure());
        assertEquals("v", r.getValue());
        assertEquals(List.of("done"), r.getMessages());
        assertTrue(r.getException().isEmpty());

        OperationResult<String> more = r.withMessage("more");
        assertEquals(List.of("done", "more"), more.getMessages());
        assertEquals(List.of("done"), r.getMessages());
    }

    @Test
    void failure_carriesException() {
        ScheduledEntityNotFoundException ex = new ScheduledEntityNotFoundException("missing");
        OperationResult<Object> r = OperationResult.failure(ex);
        assertTrue(r.isFailure());
        assertNull(r.getValue());
        assertSame(ex, r.getException().orElseThrow());
        assertEquals(List.of("missing"), r.getMessages());
    }

    @Test
    void entityRef_resolvesLiveObjectOrLooksUpId() {
        UUID id = UUID.randomUUID();
        EntityRef<String> byId = EntityRef.ofId(id);
        assertTrue(byId.isId());
        assertEquals(Optional.of("found"), byId.resolve(k -> k.equals(id) ? Optional.of("found") : Optional.empty()));

        EntityRef<String> live = EntityRef.of("live");
        assertFalse(live.isId());
        assertEquals(Optional.of("live"), live.resolve(k -> Optional.empty()));
    }
}
