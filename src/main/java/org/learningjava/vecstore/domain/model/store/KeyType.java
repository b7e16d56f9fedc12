package org.learningjava.vecstore.domain.model.store;

// native type of the collection primary key
public enum KeyType {
    INT64,
    VARCHAR
}
