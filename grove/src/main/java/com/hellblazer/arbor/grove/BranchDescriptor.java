/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Arbor.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.arbor.grove;

/**
 * One child branch of a tree node. A DNA is an ordered list of descriptors, applied identically at every level.
 *
 * @param inclination degrees the branch leans away from its parent's axis
 * @param zRotation   degrees the branch is turned about its parent's axis
 * @param scaleFactor ratio of the branch's size to its parent's
 * @author hal.hildebrand
 */
public record BranchDescriptor(double inclination, double zRotation, double scaleFactor) {
}
