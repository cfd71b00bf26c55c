package com.ofx.tagtree.convert;

/** A vendor-private data element (dotted tag such as {@code INTU.BID}) left out of a flattened map. */
public record ExtensionElement(String tag, String text) {}
