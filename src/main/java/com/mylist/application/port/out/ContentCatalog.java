package com.mylist.application.port.out;

import com.mylist.domain.model.ContentType;

/**
 * Lookup of the content a list item may reference.
 */
public interface ContentCatalog {
    boolean contentExists(String contentId, ContentType contentType);
}
