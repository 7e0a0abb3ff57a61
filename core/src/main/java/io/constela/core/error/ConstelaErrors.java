package io.constela.core.error;

import java.util.List;
import java.util.Map;

/**
 * Factory methods for {@link ConstelaError}. Keeps message wording in one place so every pass
 * reports the same text for the same problem.
 */
public final class ConstelaErrors {

    private ConstelaErrors() {}

    public static ConstelaError schema(String message, String path) {
        return new ConstelaError(ErrorCode.SCHEMA_INVALID, message, path);
    }

    public static ConstelaError unsupportedVersion(String version) {
        return new ConstelaError(
                ErrorCode.UNSUPPORTED_VERSION,
                "Unsupported version: '" + version + "'. Supported versions: 1.0",
                "/version");
    }

    public static ConstelaError maxNesting(int limit, String path) {
        return new ConstelaError(
                ErrorCode.MAX_NESTING_EXCEEDED, "Maximum nesting depth of " + limit + " exceeded", path);
    }

    public static ConstelaError maxExpandedNodes(int limit, String path) {
        return new ConstelaError(ErrorCode.MAX_EXPANDED_NODES_EXCEEDED,
                "Inlined view exceeds the maximum of " + limit + " nodes", path);
    }

    public static ConstelaError undefinedState(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_STATE, "Undefined state reference: '" + name + "' is not defined in state", path);
    }

    public static ConstelaError undefinedLocalState(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_LOCAL_STATE,
                "Undefined local state reference: '" + name + "' is not defined in localState",
                path);
    }

    public static ConstelaError undefinedAction(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_ACTION,
                "Undefined action reference: '" + name + "' is not defined in actions",
                path);
    }

    public static ConstelaError duplicateAction(String name, String path) {
        return new ConstelaError(
                ErrorCode.DUPLICATE_ACTION, "Duplicate action name: '" + name + "' is already defined", path);
    }

    public static ConstelaError undefinedVar(String name, String path) {
        return new ConstelaError(
                ErrorCode.VAR_UNDEFINED, "Undefined variable reference: '" + name + "' is not defined in scope", path);
    }

    public static ConstelaError undefinedParam(String name, String path) {
        return new ConstelaError(
                ErrorCode.PARAM_UNDEFINED,
                "Undefined param reference: '" + name + "' is not defined in component params",
                path);
    }

    public static ConstelaError undefinedRef(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_REF, "Undefined element ref: '" + name + "' is not declared in the view", path);
    }

    public static ConstelaError localActionInvalidStep(String step, String path) {
        return new ConstelaError(
                ErrorCode.LOCAL_ACTION_INVALID_STEP,
                "Local actions may only use set, update and setPath steps, got '" + step + "'",
                path);
    }

    public static ConstelaError componentNotFound(String name, String path) {
        return new ConstelaError(
                ErrorCode.COMPONENT_NOT_FOUND, "Component '" + name + "' is not defined in components", path);
    }

    public static ConstelaError componentPropMissing(String component, String prop, String path) {
        return new ConstelaError(
                ErrorCode.COMPONENT_PROP_MISSING, "Component '" + component + "' requires prop '" + prop + "'", path);
    }

    public static ConstelaError componentPropType(
            String component, String prop, String expected, String actual, String path) {
        return new ConstelaError(
                ErrorCode.COMPONENT_PROP_TYPE,
                "Component '" + component + "' prop '" + prop + "' expects " + expected + ", got " + actual,
                path);
    }

    public static ConstelaError componentCycle(List<String> cycle, String path) {
        return new ConstelaError(
                ErrorCode.COMPONENT_CYCLE,
                "Circular component reference detected: " + String.join(" -> ", cycle),
                path,
                null,
                Map.of("cycle", List.copyOf(cycle)));
    }

    public static ConstelaError operationInvalidForType(String operation, String type, String path) {
        return new ConstelaError(
                ErrorCode.OPERATION_INVALID_FOR_TYPE,
                "Operation '" + operation + "' is not valid for state of type '" + type + "'",
                path);
    }

    public static ConstelaError operationMissingField(String operation, String field, String path) {
        return new ConstelaError(
                ErrorCode.OPERATION_MISSING_FIELD,
                "Operation '" + operation + "' requires field '" + field + "'",
                path);
    }

    public static ConstelaError undefinedRouteParam(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_ROUTE_PARAM,
                "Undefined route param: '" + name + "' is not a parameter of the route path",
                path);
    }

    public static ConstelaError routeNotDefined(String path) {
        return new ConstelaError(
                ErrorCode.ROUTE_NOT_DEFINED, "Route expression used but the program defines no route", path);
    }

    public static ConstelaError importsNotDefined(String path) {
        return new ConstelaError(
                ErrorCode.IMPORTS_NOT_DEFINED, "Import expression used but the program defines no imports", path);
    }

    public static ConstelaError undefinedImport(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_IMPORT, "Undefined import: '" + name + "' is not defined in imports", path);
    }

    public static ConstelaError dataNotDefined(String path) {
        return new ConstelaError(
                ErrorCode.DATA_NOT_DEFINED, "Data expression used but the program defines no data sources", path);
    }

    public static ConstelaError undefinedData(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_DATA, "Undefined data source: '" + name + "' is not defined in data", path);
    }

    public static ConstelaError undefinedDataSource(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_DATA_SOURCE,
                "getStaticPaths source '" + name + "' is not defined in data",
                path);
    }

    public static ConstelaError invalidDataSource(String name, String reason, String path) {
        return new ConstelaError(
                ErrorCode.INVALID_DATA_SOURCE, "Invalid data source '" + name + "': " + reason, path);
    }

    public static ConstelaError undefinedStyle(String name, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_STYLE, "Undefined style preset: '" + name + "' is not defined in styles", path);
    }

    public static ConstelaError undefinedVariant(String style, String variant, String path) {
        return new ConstelaError(
                ErrorCode.UNDEFINED_VARIANT,
                "Undefined variant: '" + variant + "' is not declared by style '" + style + "'",
                path);
    }

    public static ConstelaError layoutNotFound(String name, String path) {
        return new ConstelaError(ErrorCode.LAYOUT_NOT_FOUND, "Layout '" + name + "' was not found", path);
    }

    public static ConstelaError layoutMissingSlot(String path) {
        return new ConstelaError(ErrorCode.LAYOUT_MISSING_SLOT, "Layout must contain at least one slot", path);
    }

    public static ConstelaError duplicateSlotName(String name, String path) {
        return new ConstelaError(
                ErrorCode.DUPLICATE_SLOT_NAME, "Duplicate slot name: '" + name + "' is used more than once", path);
    }

    public static ConstelaError duplicateDefaultSlot(String path) {
        return new ConstelaError(
                ErrorCode.DUPLICATE_DEFAULT_SLOT, "Layout declares more than one default slot", path);
    }

    public static ConstelaError slotInLoop(String path) {
        return new ConstelaError(ErrorCode.SLOT_IN_LOOP, "Slot must not appear inside an each loop", path);
    }

    // ── Accessibility warnings ──

    public static ConstelaError a11yImgNoAlt(String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_IMG_NO_ALT, "img element is missing an alt attribute", path);
    }

    public static ConstelaError a11yButtonNoLabel(String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_BUTTON_NO_LABEL, "button has no text content and no aria-label", path);
    }

    public static ConstelaError a11yAnchorNoLabel(String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_ANCHOR_NO_LABEL, "a element has no text content and no aria-label", path);
    }

    public static ConstelaError a11yInputNoLabel(String tag, String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_INPUT_NO_LABEL, tag + " element has no aria-label or aria-labelledby", path);
    }

    public static ConstelaError a11yHeadingSkip(int level, int expectedMax, String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_HEADING_SKIP,
                "Heading level skipped: h" + level + " follows a maximum of h" + (expectedMax - 1)
                        + "; expected h" + expectedMax + " or lower",
                path);
    }

    public static ConstelaError a11yPositiveTabindex(String value, String path) {
        return ConstelaError.warning(
                ErrorCode.A11Y_POSITIVE_TABINDEX,
                "Positive tabindex " + value + " disrupts the natural tab order",
                path);
    }

    public static ConstelaError a11yDuplicateId(String id, String path) {
        return ConstelaError.warning(ErrorCode.A11Y_DUPLICATE_ID, "Duplicate id '" + id + "'", path);
    }
}
