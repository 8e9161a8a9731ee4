/**
 * Reading and normalization of raw CSV payloads.
 *
 * <p>
 * {@link io.github.yok.cleansync.transform.CsvTransformer} resolves the text encoding of a file,
 * parses it with Apache Commons CSV and applies the fixed column rules.
 * </p>
 */
package io.github.yok.cleansync.transform;
