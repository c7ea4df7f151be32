/**
 * Value types exchanged between configuration, engine and reporting: table settings, fetched rows,
 * generated update commands and per-table results.
 */
package io.github.yok.dbanonymizer.model;
