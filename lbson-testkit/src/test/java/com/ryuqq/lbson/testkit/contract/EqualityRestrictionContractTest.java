package com.ryuqq.lbson.testkit.contract;

import com.ryuqq.lbson.adapter.inmemory.label.SetLabel;
import com.ryuqq.lbson.core.document.Document;
import com.ryuqq.lbson.core.document.Field;
import com.ryuqq.lbson.core.value.PolicyLabeled;
import com.ryuqq.lbson.core.value.Primitives;
import com.ryuqq.lbson.core.value.Vals;
import com.ryuqq.lbson.core.value.Value;
import com.ryuqq.lbson.core.value.ValueRenderer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: equality and rendering restrictions on labeled data.
 *
 * <p>Labeled values never compare equal, and in protected mode their payload never reaches a string.</p>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class EqualityRestrictionContractTest extends AbstractLbsonContractTest {

    @Test
    void testEquality_LabeledValueNeverEqual() {
        Value<SetLabel> labeled = labeledVals.labeled(Primitives.INT32).val(label(1, "a"));
        Value<SetLabel> policy = labeledVals.policyLabeled(Primitives.INT32).val(PolicyLabeled.<SetLabel, Integer>pu(1));

        assertNeverEqual(labeled);
        assertNeverEqual(policy);
    }

    @Test
    void testEquality_DocumentsWithLabeledFieldsNeverEqual() {
        Document<SetLabel> document = single("k", label(1, "a"), labeledVals.labeled(Primitives.INT32));

        assertNotEquals(document, document.include(java.util.List.of("k")));
    }

    @Test
    void testEquality_FieldsSharingLabeledValueNeverEqual() {
        // Given
        Value<SetLabel> shared = labeledVals.labeled(Primitives.STRING).val(label("s3cret", "alice"));
        Field<SetLabel> field = new Field<SetLabel>("password", shared);
        Document<SetLabel> document = Document.<SetLabel>of(field);

        // Then
        assertNotEquals(field, field);
        assertNotEquals(field, new Field<SetLabel>("password", shared));
        assertNotEquals(document, document);
    }

    @Test
    void testEquality_PlainDocumentsCompareStructurally() {
        Document<SetLabel> a = Document.of(Field.of("k", 1, Vals.<SetLabel, Integer>plain(Primitives.INT32)));
        Document<SetLabel> b = Document.of(Field.of("k", 1, Vals.<SetLabel, Integer>plain(Primitives.INT32)));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void testRendering_ProtectedModeHidesPayload() {
        Document<SetLabel> document = Document.concat(
            single("name", "alice", Vals.<SetLabel, String>plain(Primitives.STRING)),
            single("password", label("s3cret", "alice"), labeledVals.labeled(Primitives.STRING))
        );

        String rendered = document.toString();

        assertEquals("[name: \"alice\", password: " + ValueRenderer.HIDDEN + "]", rendered);
        assertFalse(rendered.contains("s3cret"));
    }

    @Test
    void testRendering_RawLabeledToStringRefused() {
        assertThrows(UnsupportedOperationException.class, () -> label("s3cret", "alice").toString());
        assertThrows(UnsupportedOperationException.class, () -> PolicyLabeled.<SetLabel, String>pu("s3cret").toString());
    }
}
