package com.flamingo.pdfstructure.service.headings;

import com.flamingo.pdfstructure.model.Block;
import com.flamingo.pdfstructure.model.NumberingInfo;

/**
 * A heading block with its assigned level.
 *
 * @param block originating block
 * @param level 1-based heading level
 * @param title heading text
 * @param numbering numbering facts attached to the block
 */
public record Heading(Block block, int level, String title, NumberingInfo numbering) {}
