package com.verolang.core.transpiler;

import com.verolang.core.ast.ActionCall;
import com.verolang.core.ast.ActionDefinition;
import com.verolang.core.ast.BooleanLiteral;
import com.verolang.core.ast.EnvVarReference;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.NumberLiteral;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.PageActions;
import com.verolang.core.ast.StringLiteral;
import com.verolang.core.ast.Target;
import com.verolang.core.ast.VariableReference;

import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Resolves targets, expressions and action calls to TypeScript against the declared pages and
 * libraries.
 *
 * <p>References the validator rejects (unknown pages, unknown actions, pages the feature does
 * not use) raise {@link TranspilerContractException}. References it only warns about are
 * emitted as runtime lookups.
 */
final class Resolver {

    private final Map<String, Page> pages;
    private final Map<String, PageActions> libraries;

    Resolver(Map<String, Page> pages, Map<String, PageActions> libraries) {
        this.pages = pages;
        this.libraries = libraries;
    }

    // Targets

    /**
     * Locator expression for {@code target}.
     */
    String locator(Target target, EmitScope scope) {
        if (target.hasSelector()) {
            return Locators.locator(scope.root(), target.selector());
        }
        String value = valueOf(target, scope);
        if (value != null) {
            return scope.root() + ".getByText(String(" + value + "))";
        }
        if (target.page() != null) {
            String instance = requireInstance(target.page(), scope);
            Page page = requirePage(target.page());
            if (page.findField(target.field()).isPresent()) {
                return TypeScript.member(instance, target.field());
            }
            return "(" + instance + " as any)." + target.field();
        }

        Optional<String> field = pageMember(target.field(), scope, true);
        return field.orElseGet(() -> scope.root() + ".getByText(" + TypeScript.quote(target.field()) + ")");
    }

    /**
     * Value expression when {@code target} names a variable rather than an element: a local
     * ({@code username}), a data row column ({@code user.email}) or a page variable. Returns null
     * for element targets.
     */
    String valueOf(Target target, EmitScope scope) {
        if (target.hasSelector()) {
            return null;
        }
        if (target.page() != null) {
            if (scope.isVariable(target.page())) {
                return TypeScript.property(target.page(), target.field());
            }
            Page page = pages.get(target.page());
            if (page != null && page.findField(target.field()).isEmpty()
                && page.findVariable(target.field()).isPresent()) {
                return TypeScript.member(requireInstance(target.page(), scope), target.field());
            }
            return null;
        }
        if (pageMember(target.field(), scope, true).isPresent()) {
            return null;
        }
        return scope.isVariable(target.field()) ? target.field() : null;
    }

    // Expressions

    String expression(Expression expression, EmitScope scope) {
        if (expression instanceof StringLiteral literal) {
            return TypeScript.quote(literal.value());
        }
        if (expression instanceof NumberLiteral number) {
            return number.text();
        }
        if (expression instanceof BooleanLiteral bool) {
            return Boolean.toString(bool.value());
        }
        if (expression instanceof EnvVarReference env) {
            return TypeScript.property("__env__", env.name());
        }
        VariableReference reference = (VariableReference) expression;
        if (reference.page() != null) {
            if (scope.isVariable(reference.page())) {
                return TypeScript.property(reference.page(), reference.name());
            }
            requirePage(reference.page());
            return TypeScript.member(requireInstance(reference.page(), scope), reference.name());
        }
        if (scope.isVariable(reference.name())) {
            return reference.name();
        }
        return pageMember(reference.name(), scope, false)
            .or(() -> pageMember(reference.name(), scope, true))
            .orElseGet(() -> TypeScript.property("__env__", reference.name()));
    }

    /**
     * Expression as a string: literals stay literals, everything else goes through {@code String()}.
     */
    String text(Expression expression, EmitScope scope) {
        if (expression instanceof StringLiteral) {
            return expression(expression, scope);
        }
        return "String(" + expression(expression, scope) + ")";
    }

    // Calls

    /**
     * Call expression for {@code PERFORM}, without the leading {@code await}.
     */
    String call(ActionCall call, EmitScope scope) {
        String arguments = call.arguments().stream()
            .map(argument -> expression(argument, scope))
            .collect(Collectors.joining(", "));
        return actionOwner(call, scope) + "." + call.action() + "(" + arguments + ")";
    }

    private String actionOwner(ActionCall call, EmitScope scope) {
        if (call.page() != null) {
            if (!isDeclared(call.page())) {
                throw new TranspilerContractException("Unknown page or page actions '" + call.page() + "'");
            }
            if (findAction(call.page(), call.action()).isEmpty()) {
                throw new TranspilerContractException(
                    "Action '" + call.action() + "' is not defined on '" + call.page() + "'");
            }
            return requireInstance(call.page(), scope);
        }

        if (scope.ownerLibrary() != null && findAction(scope.ownerLibrary(), call.action()).isPresent()) {
            return scope.instance(scope.ownerLibrary());
        }
        if (scope.ownerPage() != null && findAction(scope.ownerPage(), call.action()).isPresent()) {
            return scope.instance(scope.ownerPage());
        }
        for (Map.Entry<String, String> entry : scope.instances()) {
            if (findAction(entry.getKey(), call.action()).isPresent()) {
                return entry.getValue();
            }
        }
        throw new TranspilerContractException("No used page or page actions defines action '" + call.action() + "'");
    }

    // Lookup

    /**
     * Member of the owner page or of a used page. Fields only when {@code fields} is true,
     * page variables only otherwise.
     */
    private Optional<String> pageMember(String name, EmitScope scope, boolean fields) {
        if (scope.ownerPage() != null && declares(pages.get(scope.ownerPage()), name, fields)) {
            return Optional.of(TypeScript.member(scope.instance(scope.ownerPage()), name));
        }
        for (Map.Entry<String, String> entry : scope.instances()) {
            if (declares(pages.get(entry.getKey()), name, fields)) {
                return Optional.of(TypeScript.member(entry.getValue(), name));
            }
        }
        return Optional.empty();
    }

    private static boolean declares(Page page, String name, boolean field) {
        if (page == null) {
            return false;
        }
        return field ? page.findField(name).isPresent() : page.findVariable(name).isPresent();
    }

    private String requireInstance(String name, EmitScope scope) {
        String instance = scope.instance(name);
        if (instance != null) {
            return instance;
        }
        if (scope.isClassBody() && isDeclared(name)) {
            return "new " + TypeScript.className(name) + "(this.page)";
        }
        if (isDeclared(name)) {
            throw new TranspilerContractException("'" + name + "' is referenced but not used by the feature");
        }
        throw new TranspilerContractException("Unknown page '" + name + "'");
    }

    private Page requirePage(String name) {
        Page page = pages.get(name);
        if (page == null) {
            throw new TranspilerContractException("Unknown page '" + name + "'");
        }
        return page;
    }

    private Optional<ActionDefinition> findAction(String owner, String action) {
        if (pages.containsKey(owner)) {
            return pages.get(owner).findAction(action);
        }
        if (libraries.containsKey(owner)) {
            return libraries.get(owner).findAction(action);
        }
        return Optional.empty();
    }

    private boolean isDeclared(String name) {
        return pages.containsKey(name) || libraries.containsKey(name);
    }
}
