/**
 * Pure Java value types shared across all archive modules.
 *
 * <p>Holds the closed enumerations of extractors, resolvers and info tables so
 * that every module agrees on the names stored in the database.
 * No framework dependencies.
 */
package com.libragraph.archive.types;
