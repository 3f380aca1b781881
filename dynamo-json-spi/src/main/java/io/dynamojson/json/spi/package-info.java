/**
 * Library-neutral JSON tree model and codec SPI.
 *
 * <p>The store conversion core depends only on these interfaces. A binding such as
 * {@code dynamo-json-jackson} supplies the implementation, either passed explicitly or
 * discovered through {@link io.dynamojson.json.spi.JsonCodecs}.
 */
package io.dynamojson.json.spi;
