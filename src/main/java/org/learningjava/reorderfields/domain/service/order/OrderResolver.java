package org.learningjava.reorderfields.domain.service.order;

import org.learningjava.reorderfields.domain.model.diagnostic.ReorderErrorKind;
import org.learningjava.reorderfields.domain.model.diagnostic.ReorderException;
import org.learningjava.reorderfields.domain.model.plan.DesiredOrder;
import org.learningjava.reorderfields.domain.model.plan.Permutation;
import org.learningjava.reorderfields.domain.model.record.FieldModel;
import org.learningjava.reorderfields.domain.model.record.RecordModel;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns a list of field names into the permutation {@code new position -> old index}.
 */
@Component
public class OrderResolver {

    public Permutation resolve(RecordModel record, DesiredOrder desiredOrder) {
        Map<String, Integer> nameToIndex = new HashMap<>();
        for (FieldModel field : record.fields()) {
            nameToIndex.put(field.name(), field.index());
        }

        if (desiredOrder.size() != record.fieldCount()) {
            throw new ReorderException(ReorderErrorKind.ORDER_COUNT_MISMATCH,
                    "Number of provided fields (" + desiredOrder.size()
                            + ") doesn't match definition (" + record.fieldCount() + ")");
        }

        int[] order = new int[desiredOrder.size()];
        boolean[] taken = new boolean[order.length];
        for (int i = 0; i < order.length; i++) {
            String name = desiredOrder.names().get(i);
            Integer index = nameToIndex.get(name);
            if (index == null) {
                throw new ReorderException(ReorderErrorKind.UNKNOWN_FIELD_NAME,
                        "Field " + name + " not found in definition");
            }
            if (taken[index]) {
                throw new ReorderException(ReorderErrorKind.DUPLICATE_FIELD_NAME,
                        "Field " + name + " is listed more than once");
            }
            taken[index] = true;
            order[i] = index;
        }
        return Permutation.of(order);
    }
}
