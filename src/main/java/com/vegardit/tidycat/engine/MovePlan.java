/*
 * SPDX-FileCopyrightText: © Vegard IT GmbH (https://vegardit.com)
 * SPDX-License-Identifier: Apache-2.0
 */
package com.vegardit.tidycat.engine;

import java.nio.file.Path;

/**
 * One planned move.
 *
 * @param renamedForCollision true if the destination name differs from the source name to avoid a collision
 *
 * @author Sebastian Thomschke, Vegard IT GmbH
 */
public record MovePlan(Path source, Path destination, String ruleId, String ruleDescription, boolean renamedForCollision) {
}
