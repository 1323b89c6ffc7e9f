/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.undo;

import org.eclipse.jdt.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An executed move as persisted in a transaction record.
 *
 * @param from original location
 * @param to location the entry was moved to
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record MoveRecord( //
   @JsonProperty("from") @Nullable String from, //
   @JsonProperty("to") @Nullable String to, //
   @JsonProperty("rule_id") @Nullable String ruleId //
) {
}
