/**
 * Declarations of locally owned APIs and their events, held by an
 * {@link io.buslink.api.ApiRegistry}.
 */
package io.buslink.api;
