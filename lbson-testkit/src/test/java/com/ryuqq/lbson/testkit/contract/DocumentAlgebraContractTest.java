package com.ryuqq.lbson.testkit.contract;

import com.ryuqq.lbson.adapter.inmemory.label.SetLabel;
import com.ryuqq.lbson.core.document.Document;
import com.ryuqq.lbson.core.document.Field;
import com.ryuqq.lbson.core.outcome.ErrorCodes;
import com.ryuqq.lbson.core.spi.Labeled;
import com.ryuqq.lbson.core.value.Primitives;
import com.ryuqq.lbson.core.value.Val;
import com.ryuqq.lbson.core.value.Vals;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: document algebra over mixed plain and labeled fields.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Lookup returns the first matching field and keeps labels intact</li>
 *   <li>include follows the key list, exclude follows the document</li>
 *   <li>merge is left-biased replace-or-append</li>
 *   <li>Projections are idempotent</li>
 * </ul>
 *
 * @author LBSON Team
 * @since 1.0.0
 */
class DocumentAlgebraContractTest extends AbstractLbsonContractTest {

    private final Val<SetLabel, String> string = Vals.<SetLabel, String>plain(Primitives.STRING);
    private final Val<SetLabel, Integer> int32 = Vals.<SetLabel, Integer>plain(Primitives.INT32);

    private Document<SetLabel> user() {
        return Document.of(
            Field.of("name", "alice", string),
            Field.of("password", label("s3cret", "alice"), labeledVals.labeled(Primitives.STRING)),
            Field.of("age", 30, int32)
        );
    }

    @Test
    void testLookup_LabeledFieldKeepsLabel() {
        // When
        Labeled<SetLabel, String> password = user().at("password", labeledVals.labeled(Primitives.STRING));

        // Then
        assertEquals(SetLabel.of("alice"), password.label());
        assertEquals("s3cret", unlabel(password));
    }

    @Test
    void testLookup_AbsentAndMistypedAreDistinguished() {
        Document<SetLabel> user = user();

        assertFailedWith(user.lookup("email", string), ErrorCodes.KEY_NOT_FOUND);
        assertFailedWith(user.lookup("password", string), ErrorCodes.TYPE_MISMATCH);
        assertFailedWith(user.lookup("name", labeledVals.labeled(Primitives.STRING)), ErrorCodes.TYPE_MISMATCH);
    }

    @Test
    void testLookup_FailureMessageHidesLabeledPayload() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> user().at("password", string));

        assertFalse(e.getMessage().contains("s3cret"), "Failure message must not leak labeled payloads");
        assertTrue(e.getMessage().startsWith("expected (\"password\" :: String) in ["));
    }

    @Test
    void testInclude_FollowsKeyListOrder() {
        assertKeys(user().include(List.of("age", "name", "missing")), "age", "name");
    }

    @Test
    void testInclude_Idempotent() {
        Document<SetLabel> plain = Document.of(Field.of("a", 1, int32), Field.of("b", 2, int32));
        Document<SetLabel> once = plain.include(List.of("b", "a"));

        assertEquals(once, once.include(List.of("b", "a")));
    }

    @Test
    void testExclude_PreservesDocumentOrder() {
        assertKeys(user().exclude(List.of("password")), "name", "age");
    }

    @Test
    void testMerge_LeftBiasedReplaceOrAppend() {
        // Given
        Document<SetLabel> base = Document.of(Field.of("a", 1, int32), Field.of("b", 2, int32));
        Document<SetLabel> patch = Document.of(Field.of("b", 20, int32), Field.of("c", 3, int32));

        // When
        Document<SetLabel> merged = patch.merge(base);

        // Then
        assertKeys(merged, "a", "b", "c");
        assertEquals(1, merged.at("a", int32));
        assertEquals(20, merged.at("b", int32));
        assertEquals(3, merged.at("c", int32));
    }

    @Test
    void testMerge_LabeledFieldReplacesPlainField() {
        Document<SetLabel> base = single("note", "public", string);
        Document<SetLabel> patch = single("note", label("private", "bob"), labeledVals.labeled(Primitives.STRING));

        Document<SetLabel> merged = patch.merge(base);

        assertKeys(merged, "note");
        assertTrue(merged.valueAt("note").isLabeled());
    }

    @Test
    void testConcat_OptionalFieldsAssembleDocument() {
        Document<SetLabel> document = Document.concat(
            single("name", "alice", string),
            Field.optional("nick", Optional.empty(), string),
            Field.optional("age", Optional.of(30), int32)
        );

        assertKeys(document, "name", "age");
    }
}
