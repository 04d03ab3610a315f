/**
 * Internal helpers: payload codec and thread factory.
 */
package io.jobworker.util;
