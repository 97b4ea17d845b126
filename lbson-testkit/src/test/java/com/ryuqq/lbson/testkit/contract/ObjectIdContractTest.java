package com.ryuqq.lbson.testkit.contract;

import com.ryuqq.lbson.core.value.ObjectIds;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: ObjectId generation through the runtime's effect runner.
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class ObjectIdContractTest extends AbstractLbsonContractTest {

    @Test
    void testGenObjectId_RunsAsRuntimeEffect() {
        // When
        ObjectId id = ObjectIds.genObjectId(runtime);

        // Then
        assertNotNull(id);
        assertEquals(1, runtime.effectCount());
    }

    @Test
    void testGenObjectId_Unique() {
        Set<ObjectId> ids = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            ids.add(ObjectIds.genObjectId(runtime));
        }

        assertEquals(1000, ids.size());
        assertEquals(1000, runtime.effectCount());
    }

    @Test
    void testTimestamp_CloseToGenerationTime() {
        Instant before = Instant.now().minusSeconds(1);

        Instant stamp = ObjectIds.timestamp(ObjectIds.genObjectId(runtime));

        assertFalse(stamp.isBefore(before.minus(Duration.ofSeconds(1))));
        assertFalse(stamp.isAfter(Instant.now().plusSeconds(1)));
    }
}
