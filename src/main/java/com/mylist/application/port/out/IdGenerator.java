package com.mylist.application.port.out;

import java.util.UUID;

/**
 * Source of list item identities. Ids double as the tie-breaker between items with equal timestamps,
 * so implementations must hand out time-ordered values.
 */
public interface IdGenerator {

    UUID generate();
}
