package com.libragraph.archive.formats.extract;

import com.libragraph.archive.types.ItemKind;

/**
 * The archive item an extractor is being resolved for.
 *
 * @param kind        acquisition or file
 * @param id          row id of the item
 * @param name        item name
 * @param acqTypeName name of the owning acquisition's type (the acquisition's own
 *                    type when {@code kind} is {@link ItemKind#ACQUISITION})
 */
public record OwningItem(ItemKind kind, long id, String name, String acqTypeName) {
}
