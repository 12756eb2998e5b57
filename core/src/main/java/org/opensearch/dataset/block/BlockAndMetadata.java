/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

/** A block together with the metadata computed when it was produced. */
public record BlockAndMetadata(Block block, BlockMetadata metadata) {}
