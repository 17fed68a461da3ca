package io.buildeval.core.evaluation.condition;

import io.buildeval.core.evaluation.EscapingUtilities;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/** {@code Exists(path)} and {@code HasTrailingSlash(text)}. */
final class FunctionCallNode extends ConditionNode {

    private final String name;
    private final List<ConditionNode> arguments;

    FunctionCallNode(String name, List<ConditionNode> arguments) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    @Override
    boolean evaluate(ConditionState state) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "exists":
                return exists(state, singleArgument(state));
            case "hastrailingslash":
                String value = singleArgument(state);
                return value.endsWith("/") || value.endsWith("\\");
            default:
                throw new Failure("UndefinedFunctionCall", "the function \"" + name + "\" is not defined");
        }
    }

    private String singleArgument(ConditionState state) {
        if (arguments.size() != 1) {
            throw new Failure(
                    "IncorrectNumberOfFunctionArguments",
                    "the function \"" + name + "\" expects 1 argument but was given " + arguments.size());
        }
        return EscapingUtilities.unescape(arguments.get(0).expandedValue(state));
    }

    private static boolean exists(ConditionState state, String path) {
        String trimmed = path.trim();
        if (trimmed.isEmpty()) {
            return false;
        }
        try {
            Path resolved = state.evaluationDirectory().resolve(trimmed.replace('\\', '/'));
            return Files.exists(resolved);
        } catch (InvalidPathException e) {
            return false;
        }
    }
}
