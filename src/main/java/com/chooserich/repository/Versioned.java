package com.chooserich.repository;

/**
 * A session as read from the store together with the version a later compare-and-swap must name.
 */
public record Versioned<S>(S value, long version) {
}
