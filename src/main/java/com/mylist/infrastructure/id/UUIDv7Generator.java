package com.mylist.infrastructure.id;

import com.fasterxml.uuid.Generators;
import com.fasterxml.uuid.NoArgGenerator;
import com.mylist.application.port.out.IdGenerator;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.UUID;

/**
 * RFC 9562 version 7 ids: a millisecond Unix timestamp followed by random bits. List items created in the
 * same millisecond still get strictly increasing ids from one instance, which keeps the
 * (createdAt, id) order of a user's list aligned with insertion order.
 */
@Component
public class UUIDv7Generator implements IdGenerator {

    private final NoArgGenerator generator = Generators.timeBasedEpochGenerator(new SecureRandom());

    @Override
    public UUID generate() {
        return generator.generate();
    }
}
