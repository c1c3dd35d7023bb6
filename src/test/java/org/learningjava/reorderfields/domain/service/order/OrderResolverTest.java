package org.learningjava.reorderfields.domain.service.order;

import org.junit.jupiter.api.Test;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.DesiredOrder;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.record.AccessLevel;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.learningjava.reorderfields.domain.model.source.SourceFile;
import org.learningjava.reorderfields.domain.model.source.SourceLocation;
import org.learningjava.reorderfields.domain.model.source.SourceRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OrderResolverTest {

    private final OrderResolver resolver = new OrderResolver();

    private static RecordModel record(String... names) {
        SourceFile file = new SourceFile("foo.h", "struct Foo { ... };");
        List<FieldModel> fields = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            fields.add(new FieldModel(names[i], i, AccessLevel.PUBLIC, new SourceRange("foo.h", i, i + 1),
                    SourceLocation.fileLocation("foo.h", i), null));
        }
        return new RecordModel("Foo", "Foo", file, new SourceRange("foo.h", 0, 19), fields, false, true, Set.of());
    }

    @Test
    void maps_names_to_old_indices() {
        Permutation p = resolver.resolve(record("a", "b", "c"), DesiredOrder.of("c", "a", "b"));

        assertEquals(Permutation.of(2, 0, 1), p);
    }

    @Test
    void same_order_gives_identity() {
        assertTrue(resolver.resolve(record("a", "b"), DesiredOrder.of("a", "b")).isIdentity());
    }

    @Test
    void count_mismatch_is_reported_with_both_sizes() {
        ReorderException e = assertThrows(ReorderException.class,
                () -> resolver.resolve(record("a", "b", "c"), DesiredOrder.of("a", "b")));

        assertEquals(ReorderErrorKind.ORDER_COUNT_MISMATCH, e.kind());
        assertEquals("Number of provided fields (2) doesn't match definition (3)", e.getMessage());
    }

    @Test
    void unknown_name_is_reported() {
        ReorderException e = assertThrows(ReorderException.class,
                () -> resolver.resolve(record("a", "b"), DesiredOrder.of("a", "z")));

        assertEquals(ReorderErrorKind.UNKNOWN_FIELD_NAME, e.kind());
        assertEquals("Field z not found in definition", e.getMessage());
    }

    @Test
    void repeated_name_is_rejected() {
        ReorderException e = assertThrows(ReorderException.class,
                () -> resolver.resolve(record("a", "b"), DesiredOrder.of("a", "a")));

        assertEquals(ReorderErrorKind.DUPLICATE_FIELD_NAME, e.kind());
    }

    @Test
    void unnamed_field_cannot_be_placed_by_name() {
        ReorderException e = assertThrows(ReorderException.class,
                () -> resolver.resolve(record("a", ""), DesiredOrder.of("a", "b")));

        assertEquals(ReorderErrorKind.UNKNOWN_FIELD_NAME, e.kind());
    }
}
