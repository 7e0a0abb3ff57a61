package io.constela.core.error;

/**
 * Closed taxonomy of user-facing compile errors. The constant names are the wire codes emitted in
 * {@code ConstelaError.code}.
 */
public enum ErrorCode {
    // Schema validation
    SCHEMA_INVALID,
    UNSUPPORTED_VERSION,
    MAX_NESTING_EXCEEDED,
    MAX_EXPANDED_NODES_EXCEEDED,

    // References
    UNDEFINED_STATE,
    UNDEFINED_ACTION,
    DUPLICATE_ACTION,
    VAR_UNDEFINED,
    PARAM_UNDEFINED,
    UNDEFINED_REF,
    UNDEFINED_LOCAL_STATE,
    LOCAL_ACTION_INVALID_STEP,

    // Components
    COMPONENT_NOT_FOUND,
    COMPONENT_PROP_MISSING,
    COMPONENT_PROP_TYPE,
    COMPONENT_CYCLE,

    // Update steps
    OPERATION_INVALID_FOR_TYPE,
    OPERATION_MISSING_FIELD,

    // Routes
    UNDEFINED_ROUTE_PARAM,
    ROUTE_NOT_DEFINED,

    // Imports and data
    UNDEFINED_IMPORT,
    IMPORTS_NOT_DEFINED,
    UNDEFINED_DATA,
    DATA_NOT_DEFINED,
    UNDEFINED_DATA_SOURCE,
    INVALID_DATA_SOURCE,

    // Styles
    UNDEFINED_STYLE,
    UNDEFINED_VARIANT,

    // Layouts
    LAYOUT_NOT_FOUND,
    LAYOUT_MISSING_SLOT,
    DUPLICATE_SLOT_NAME,
    DUPLICATE_DEFAULT_SLOT,
    SLOT_IN_LOOP,

    // Accessibility (warnings)
    A11Y_IMG_NO_ALT,
    A11Y_BUTTON_NO_LABEL,
    A11Y_ANCHOR_NO_LABEL,
    A11Y_INPUT_NO_LABEL,
    A11Y_HEADING_SKIP,
    A11Y_POSITIVE_TABINDEX,
    A11Y_DUPLICATE_ID
}
