package com.rulesdsl.builder;

import java.util.List;

/**
 * Product facts given to the model on the first turn.
 *
 * @param name           Product name
 * @param lineOfBusiness Line of business
 * @param coverages      Available coverages
 * @param forms          Available forms
 */
public record ProductContext(String name, String lineOfBusiness, List<NamedRef> coverages, List<NamedRef> forms) {

    public ProductContext {
        coverages = coverages == null ? List.of() : List.copyOf(coverages);
        forms = forms == null ? List.of() : List.copyOf(forms);
    }
}
