/**
 * Shared utilities for all archive modules: acquisition timestamp parsing and
 * sample statistics. No framework dependencies.
 */
package com.libragraph.archive.util;
