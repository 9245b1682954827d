package com.arkham.logging.testing;

import com.arkham.logging.event.Outcome;
import com.arkham.logging.event.WideEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordingWideEventEmitter")
class RecordingWideEventEmitterTest {

    private static WideEvent event(String operationId, String service) {
        return new WideEvent(operationId, "trace_1", Instant.EPOCH, 0, service, Outcome.SUCCESS,
                null, null, null, null, null, null, null, null);
    }

    @Test
    @DisplayName("should keep events in order and find the last per service")
    void shouldRecordInOrder() {
        RecordingWideEventEmitter recorder = new RecordingWideEventEmitter();

        recorder.emit(event("op_1", "orders.create"));
        recorder.emit(event("op_2", "orders.list"));
        recorder.emit(event("op_3", "orders.create"));

        assertThat(recorder.size()).isEqualTo(3);
        assertThat(recorder.lastFor("orders.create")).get().extracting(WideEvent::operationId).isEqualTo("op_3");
        assertThat(recorder.lastFor("orders.cancel")).isEmpty();

        recorder.clear();

        assertThat(recorder.events()).isEmpty();
    }
}
