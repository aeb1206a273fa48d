/**
 * Seam for validating event messages against the shared API schema.
 */
package io.buslink.schema;
