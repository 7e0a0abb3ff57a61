package io.constela.core.analysis;

import com.fasterxml.jackson.databind.JsonNode;
import io.constela.core.error.ConstelaError;
import io.constela.core.error.ConstelaErrors;
import io.constela.core.error.JsonPointers;
import io.constela.core.model.Expression;
import io.constela.core.model.Program;
import io.constela.core.model.PropValue;
import io.constela.core.model.ViewNode;
import io.constela.core.model.ViewWalker;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accessibility checks over the page's own view. Findings are warnings: they are reported with a
 * successful compile and never block it.
 *
 * <p>
 * Component definitions are not visited, only the children passed at call sites. Heading levels
 * and ids are tracked in document order across the whole view.
 */
public final class A11yValidator {

    private static final Pattern HEADING = Pattern.compile("h([1-6])");
    private static final Set<String> FORM_INPUTS = Set.of("input", "textarea", "select");

    private A11yValidator() {}

    public static List<ConstelaError> validate(Program program) {
        Objects.requireNonNull(program, "program must not be null");
        Checker checker = new Checker();
        checker.walk(program.view(), "/view");
        return List.copyOf(checker.warnings);
    }

    private static boolean hasTextChild(List<ViewNode> children) {
        for (ViewNode child : children) {
            if (child instanceof ViewNode.Text) {
                return true;
            }
        }
        return false;
    }

    /** The literal JSON value of a prop, or {@code null} when it is not a {@code lit} expression. */
    private static JsonNode literal(Map<String, PropValue> props, String name) {
        PropValue value = props.get(name);
        return value instanceof Expression.Lit lit ? lit.value() : null;
    }

    private static final class Checker extends ViewWalker<String> {
        private final List<ConstelaError> warnings = new ArrayList<>();
        private final Set<String> seenIds = new HashSet<>();
        private int maxHeadingLevel;

        @Override
        protected String descend(String path, String... segments) {
            return JsonPointers.append(path, segments);
        }

        @Override
        public Void visit(ViewNode.Element node, String path) {
            check(node, path);
            return super.visit(node, path);
        }

        private void check(ViewNode.Element node, String path) {
            String tag = node.tag();
            Map<String, PropValue> props = node.props();
            boolean ariaLabel = props.containsKey("aria-label");

            if (tag.equals("img") && !props.containsKey("alt")) {
                warnings.add(ConstelaErrors.a11yImgNoAlt(path));
            }
            if (tag.equals("button") && !ariaLabel && !hasTextChild(node.children())) {
                warnings.add(ConstelaErrors.a11yButtonNoLabel(path));
            }
            if (tag.equals("a") && !ariaLabel && !hasTextChild(node.children())) {
                warnings.add(ConstelaErrors.a11yAnchorNoLabel(path));
            }
            if (FORM_INPUTS.contains(tag) && !ariaLabel && !props.containsKey("aria-labelledby")) {
                warnings.add(ConstelaErrors.a11yInputNoLabel(tag, path));
            }

            Matcher heading = HEADING.matcher(tag);
            if (heading.matches()) {
                int level = Integer.parseInt(heading.group(1));
                if (maxHeadingLevel > 0 && level > maxHeadingLevel + 1) {
                    warnings.add(ConstelaErrors.a11yHeadingSkip(level, maxHeadingLevel + 1, path));
                }
                maxHeadingLevel = Math.max(maxHeadingLevel, level);
            }

            JsonNode tabindex = literal(props, "tabindex");
            if (tabindex != null && tabindex.isNumber() && tabindex.asDouble() > 0) {
                warnings.add(ConstelaErrors.a11yPositiveTabindex(tabindex.asText(), path));
            }

            JsonNode id = literal(props, "id");
            if (id != null && id.isTextual() && !seenIds.add(id.asText())) {
                warnings.add(ConstelaErrors.a11yDuplicateId(id.asText(), path));
            }
        }
    }
}
