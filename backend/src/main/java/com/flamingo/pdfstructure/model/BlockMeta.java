package com.flamingo.pdfstructure.model;

/**
 * Type-specific facts attached to a {@link Block}.
 *
 * <p>Implemented by {@link ListMeta}, {@link CodeMeta} and {@link TableMeta}; blocks of other
 * kinds carry no metadata.
 */
public interface BlockMeta {}
