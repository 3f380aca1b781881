/**
 * Conversion between generic JSON trees and document store attribute values.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>The {@link io.dynamojson.core.AttributeValue} union and its wire tags</li>
 *   <li>The encoder (JSON to store) and decoder (store to JSON)</li>
 *   <li>{@link io.dynamojson.core.DynamoJson}, binding both to a JSON codec for typed values</li>
 * </ul>
 *
 * <p>The JSON library binding and the AWS SDK bridge live in other modules.
 */
package io.dynamojson.core;
