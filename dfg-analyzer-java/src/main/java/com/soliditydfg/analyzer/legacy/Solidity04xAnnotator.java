package com.soliditydfg.analyzer.legacy;

import com.soliditydfg.analyzer.ast.AstAnnotator;
import com.soliditydfg.analyzer.ast.AstNode;
import com.soliditydfg.analyzer.ast.AstTree;
import com.soliditydfg.analyzer.ast.ContractNode;
import com.soliditydfg.analyzer.ast.FunctionNode;
import com.soliditydfg.analyzer.ast.StateMutability;
import com.soliditydfg.analyzer.ast.VariableNode;
import com.soliditydfg.analyzer.ast.Visibility;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Stamps 0.4.x semantics onto a built tree: name-based constructors, {@code constant}
 * functions as {@code view}, implicit default visibilities, and usage of globals and call
 * forms that later versions removed or renamed.
 */
public class Solidity04xAnnotator implements AstAnnotator {

    public static final String VERSION_LABEL = "0.4.x";

    private static final List<String> LEGACY_GLOBALS = List.of("now", "msg", "block", "tx", "this", "super");

    private static final Map<String, String> LEGACY_CALL_SYNTAX = orderedMap(
        ".call.value(", "call_value_syntax",
        ".transfer(", "transfer_syntax",
        ".send(", "send_syntax",
        ".delegatecall(", "delegatecall_syntax"
    );

    private static final Pattern SIZED_UINT = Pattern.compile("\\buint\\d*\\b");
    private static final Pattern SIZED_INT = Pattern.compile("\\bint\\d*\\b");
    private static final Pattern SIZED_BYTES = Pattern.compile("\\bbytes\\d+\\b");
    private static final Pattern CONSTRUCTOR_ARGS_INHERITANCE = Pattern.compile("\\w+\\([^)]*\\)\\s*is\\s*\\w+");

    private final Set<String> warnings = new LinkedHashSet<>();

    @Override
    public void annotate(AstTree tree) {
        for (AstNode node : tree.preOrder()) {
            annotateNode(node, tree);
        }
    }

    /** Deprecation warnings gathered over every tree annotated so far. */
    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    private void annotateNode(AstNode node, AstTree tree) {
        Map<String, Object> metadata = node.getMetadata();
        metadata.put("solidity_version", VERSION_LABEL);
        metadata.put("is_legacy", true);

        if (node instanceof FunctionNode function) {
            annotateFunction(function, tree);
        } else if (node instanceof VariableNode variable) {
            annotateVariable(variable);
        } else if (node instanceof ContractNode contract) {
            metadata.put("inheritance", inheritanceOf(contract));
        }

        String text = node.getText();
        if (text.isEmpty()) return;

        List<String> globals = legacyGlobalsIn(text);
        if (!globals.isEmpty()) metadata.put("legacy_global_vars", globals);
        if (text.contains("now")) metadata.put("uses_now_keyword", true);
        if (text.contains("suicide")) metadata.put("uses_suicide_keyword", true);

        Map<String, Boolean> callSyntax = new LinkedHashMap<>();
        LEGACY_CALL_SYNTAX.forEach((marker, key) -> {
            if (text.contains(marker)) callSyntax.put(key, true);
        });
        if (!callSyntax.isEmpty()) metadata.put("legacy_call_syntax", callSyntax);

        Map<String, Boolean> typeSyntax = typeSyntaxOf(text);
        if (!typeSyntax.isEmpty()) metadata.put("legacy_type_syntax", typeSyntax);

        // Function text covers its body; nested nodes would repeat the same warnings.
        if (node instanceof FunctionNode) {
            warnings.addAll(deprecationWarnings(text));
        }
    }

    private void annotateFunction(FunctionNode function, AstTree tree) {
        Map<String, Object> metadata = function.getMetadata();

        Optional<String> contractName = tree.parentOf(function).flatMap(AstNode::getName);
        if (contractName.isPresent() && isLegacyConstructor(function, contractName.get())) {
            metadata.put("is_legacy_constructor", true);
            function.markConstructor();
        }

        if (function.getStateMutability().orElse(null) == StateMutability.CONSTANT) {
            metadata.put("legacy_state_mutability", StateMutability.VIEW.keyword());
            function.setStateMutability(StateMutability.VIEW);
        }

        if (function.getVisibility().isEmpty()) {
            metadata.put("default_visibility", Visibility.PUBLIC.keyword());
            function.setVisibility(Visibility.PUBLIC);
        }
    }

    private void annotateVariable(VariableNode variable) {
        Map<String, Object> metadata = variable.getMetadata();
        if (variable.isConstant() || variable.getText().contains("constant")) {
            metadata.put("has_constant_modifier", true);
            variable.markConstant();
        }
        if (variable.isStateVariable() && variable.getVisibility().isEmpty()) {
            metadata.put("default_visibility", Visibility.INTERNAL.keyword());
            variable.setVisibility(Visibility.INTERNAL);
        }
    }

    /** A 0.4.x constructor is a function named after its contract. */
    static boolean isLegacyConstructor(FunctionNode function, String contractName) {
        return !function.isConstructor()
            && function.getName().map(contractName::equals).orElse(false);
    }

    private static Map<String, Object> inheritanceOf(ContractNode contract) {
        List<String> bases = contract.getBaseContracts();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("has_inheritance", !bases.isEmpty());
        info.put("base_contracts", bases);
        info.put("multiple_inheritance", bases.size() > 1);
        if (contract.getText().contains(" is ")) {
            info.put("uses_is_keyword", true);
        }
        if (CONSTRUCTOR_ARGS_INHERITANCE.matcher(contract.getText()).find()) {
            info.put("constructor_args_inheritance", true);
        }
        return info;
    }

    private static List<String> legacyGlobalsIn(String text) {
        List<String> found = new ArrayList<>();
        for (String global : LEGACY_GLOBALS) {
            if (Pattern.compile("\\b" + Pattern.quote(global) + "\\b").matcher(text).find()) {
                found.add(global);
            }
        }
        return found;
    }

    private static Map<String, Boolean> typeSyntaxOf(String text) {
        Map<String, Boolean> features = new LinkedHashMap<>();
        if (text.contains("var ")) features.put("var_keyword", true);
        if (SIZED_UINT.matcher(text).find()) features.put("uint_sized", true);
        if (SIZED_INT.matcher(text).find()) features.put("int_sized", true);
        if (SIZED_BYTES.matcher(text).find()) features.put("bytes_sized", true);
        return features;
    }

    static List<String> deprecationWarnings(String text) {
        List<String> result = new ArrayList<>();
        if (text.contains("suicide(")) {
            result.add("suicide() is deprecated, use selfdestruct() instead");
        }
        if (text.contains("var ")) {
            result.add("var keyword is deprecated, specify explicit type instead");
        }
        if (text.contains("callcode(")) {
            result.add("callcode() is deprecated, use delegatecall() instead");
        }
        if (text.contains("constructor()")) {
            result.add("constructor() keyword not available in 0.4.x, use contract name instead");
        }
        return result;
    }

    private static Map<String, String> orderedMap(String... keysAndValues) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
