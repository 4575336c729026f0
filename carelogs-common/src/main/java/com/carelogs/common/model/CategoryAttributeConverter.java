package com.carelogs.common.model;

import software.amazon.awssdk.enhanced.dynamodb.AttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.AttributeValueType;
import software.amazon.awssdk.enhanced.dynamodb.EnhancedType;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Stores a Category by its lower-case wire name ("red", "amber", "green").
 */
public class CategoryAttributeConverter implements AttributeConverter<Category> {

    @Override
    public AttributeValue transformFrom(Category category) {
        return AttributeValue.builder().s(category.wireName()).build();
    }

    @Override
    public Category transformTo(AttributeValue value) {
        return Category.fromWireName(value.s());
    }

    @Override
    public EnhancedType<Category> type() {
        return EnhancedType.of(Category.class);
    }

    @Override
    public AttributeValueType attributeValueType() {
        return AttributeValueType.S;
    }
}
