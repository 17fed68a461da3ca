package io.buildeval.core.evaluation.expander;

import io.buildeval.core.evaluation.EvaluatedItem;
import java.util.List;

/** Supplies the current items of a type to an {@link Expander}. */
@FunctionalInterface
public interface ItemProvider {

    /**
     * Items of {@code itemType} in evaluation order; empty when there are none.
     */
    List<EvaluatedItem> getItems(String itemType);
}
