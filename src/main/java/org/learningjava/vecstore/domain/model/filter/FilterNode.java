package org.learningjava.vecstore.domain.model.filter;

/**
 * A node of a metadata filter tree: either a leaf comparison or a group of nodes joined by
 * one condition. The variant is closed, consumers switch on it structurally.
 */
public sealed interface FilterNode permits MetadataFilter, MetadataFilterGroup {
}
