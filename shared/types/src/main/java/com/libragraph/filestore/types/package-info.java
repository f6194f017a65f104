/**
 * Pure Java value types shared across all file store modules.
 *
 * <p>{@link com.libragraph.filestore.types.FileRecord} is the catalog entity;
 * the remaining types describe listing and deletion results.
 * This module has no framework dependencies.
 */
package com.libragraph.filestore.types;
