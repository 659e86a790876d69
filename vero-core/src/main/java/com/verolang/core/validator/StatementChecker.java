package com.verolang.core.validator;

import com.verolang.core.ast.ActionCall;
import com.verolang.core.ast.ActionDefinition;
import com.verolang.core.ast.Condition;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Field;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.Target;
import com.verolang.core.ast.Variable;
import com.verolang.core.ast.VariableReference;
import com.verolang.core.ast.query.DataCondition;
import com.verolang.core.ast.statement.CheckStatement;
import com.verolang.core.ast.statement.ClearStatement;
import com.verolang.core.ast.statement.ClickStatement;
import com.verolang.core.ast.statement.CookieStatement;
import com.verolang.core.ast.statement.DataQueryStatement;
import com.verolang.core.ast.statement.DialogStatement;
import com.verolang.core.ast.statement.DragStatement;
import com.verolang.core.ast.statement.FillStatement;
import com.verolang.core.ast.statement.ForEachStatement;
import com.verolang.core.ast.statement.FrameStatement;
import com.verolang.core.ast.statement.HoverStatement;
import com.verolang.core.ast.statement.IfStatement;
import com.verolang.core.ast.statement.LoadStatement;
import com.verolang.core.ast.statement.LogStatement;
import com.verolang.core.ast.statement.OpenStatement;
import com.verolang.core.ast.statement.PerformStatement;
import com.verolang.core.ast.statement.PressStatement;
import com.verolang.core.ast.statement.RefreshStatement;
import com.verolang.core.ast.statement.RepeatStatement;
import com.verolang.core.ast.statement.ReturnStatement;
import com.verolang.core.ast.statement.ScreenshotStatement;
import com.verolang.core.ast.statement.ScrollStatement;
import com.verolang.core.ast.statement.SelectStatement;
import com.verolang.core.ast.statement.Statement;
import com.verolang.core.ast.statement.StatementVisitor;
import com.verolang.core.ast.statement.StorageStatement;
import com.verolang.core.ast.statement.TabStatement;
import com.verolang.core.ast.statement.UploadStatement;
import com.verolang.core.ast.statement.VariableDeclaration;
import com.verolang.core.ast.statement.VerifyElementStatement;
import com.verolang.core.ast.statement.VerifyPageStatement;
import com.verolang.core.ast.statement.VerifyVariableStatement;
import com.verolang.core.ast.statement.WaitForElementStatement;
import com.verolang.core.ast.statement.WaitForLoadStatement;
import com.verolang.core.ast.statement.WaitForUrlStatement;
import com.verolang.core.ast.statement.WaitStatement;
import com.verolang.core.error.ValidationErrors;
import com.verolang.core.error.VeroError;
import com.verolang.core.util.NameUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checks the statements of one scenario, hook or action body.
 *
 * <p>The variable scope starts from the given names and grows as statements bind new ones.
 * {@code FOR EACH} bodies see the loop item; bindings made inside them stay local.
 */
final class StatementChecker implements StatementVisitor<Void> {

    private final Definitions definitions;
    private final List<VeroError> diagnostics;
    private final Set<String> visible;
    private final Page owner;
    private final String tabRestriction;
    private Set<String> scope;

    /**
     * @param definitions known pages and libraries
     * @param diagnostics sink for findings
     * @param visible page and library names the body may reference
     * @param owner page whose fields bare names resolve to first, or null
     * @param tabRestriction description of the body when tab control is forbidden there, or null
     * @param initialScope names bound before the first statement
     */
    StatementChecker(Definitions definitions, List<VeroError> diagnostics, Collection<String> visible,
                     Page owner, String tabRestriction, Collection<String> initialScope) {
        this.definitions = definitions;
        this.diagnostics = diagnostics;
        this.visible = new LinkedHashSet<>(visible);
        this.owner = owner;
        this.tabRestriction = tabRestriction;
        this.scope = new LinkedHashSet<>(initialScope);
    }

    void check(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
    }

    // Resolution

    private Optional<Page> resolvePage(String name, int line) {
        if (!definitions.isDefined(name)) {
            diagnostics.add(ValidationErrors.pageNotImported(name, false, line));
            return Optional.empty();
        }
        if (!visible.contains(name)) {
            diagnostics.add(ValidationErrors.pageNotImported(name, true, line));
            return Optional.empty();
        }
        return definitions.page(name);
    }

    private List<Page> visiblePages() {
        List<Page> pages = new ArrayList<>();
        if (owner != null) {
            pages.add(owner);
        }
        for (String name : visible) {
            definitions.page(name).filter(page -> !pages.contains(page)).ifPresent(pages::add);
        }
        return pages;
    }

    private void checkTarget(Target target, int line) {
        if (target == null || target.hasSelector()) {
            return;
        }
        String field = target.field();
        if (target.page() != null) {
            if (scope.contains(target.page())) {
                return;
            }
            resolvePage(target.page(), line).ifPresent(page -> {
                if (page.findField(field).isEmpty() && page.findVariable(field).isEmpty()) {
                    diagnostics.add(ValidationErrors.undefinedField(page.name(), field, line,
                        NameUtils.findSimilar(field, fieldNames(List.of(page)))));
                }
            });
            return;
        }
        if (scope.contains(field)) {
            return;
        }
        List<Page> pages = visiblePages();
        boolean known = pages.stream().anyMatch(page -> page.findField(field).isPresent());
        if (!known) {
            diagnostics.add(ValidationErrors.undefinedField(null, field, line,
                NameUtils.findSimilar(field, fieldNames(pages))));
        }
    }

    private void checkExpression(Expression expression, int line) {
        if (!(expression instanceof VariableReference reference)) {
            return;
        }
        String name = reference.name();
        if (reference.page() != null) {
            if (scope.contains(reference.page())) {
                return;
            }
            resolvePage(reference.page(), line).ifPresent(page -> {
                if (page.findVariable(name).isEmpty() && page.findField(name).isEmpty()) {
                    diagnostics.add(ValidationErrors.undefinedVariable(page.name(), name, line,
                        NameUtils.findSimilar(name, variableNames(List.of(page)))));
                }
            });
            return;
        }
        if (scope.contains(name)) {
            return;
        }
        List<Page> pages = visiblePages();
        boolean known = pages.stream()
            .anyMatch(page -> page.findVariable(name).isPresent() || page.findField(name).isPresent());
        if (!known) {
            List<String> candidates = new ArrayList<>(scope);
            candidates.addAll(variableNames(pages));
            diagnostics.add(ValidationErrors.undefinedVariable(null, name, line,
                NameUtils.findSimilar(name, candidates)));
        }
    }

    private void checkExpressions(List<Expression> expressions, int line) {
        expressions.forEach(expression -> checkExpression(expression, line));
    }

    private void checkDataCondition(DataCondition condition, int line) {
        if (condition == null) {
            return;
        }
        if (condition instanceof DataCondition.Compare compare) {
            checkExpression(compare.value(), line);
            checkExpressions(compare.values(), line);
        } else if (condition instanceof DataCondition.And and) {
            checkDataCondition(and.left(), line);
            checkDataCondition(and.right(), line);
        } else if (condition instanceof DataCondition.Or or) {
            checkDataCondition(or.left(), line);
            checkDataCondition(or.right(), line);
        } else if (condition instanceof DataCondition.Not not) {
            checkDataCondition(not.condition(), line);
        }
    }

    private void checkCall(ActionCall call, int line) {
        checkExpressions(call.arguments(), line);
        String ownerName = call.page();
        if (ownerName != null) {
            if (!definitions.isDefined(ownerName)) {
                diagnostics.add(ValidationErrors.pageNotImported(ownerName, false, line));
                return;
            }
            if (!visible.contains(ownerName) && (owner == null || !owner.name().equals(ownerName))) {
                diagnostics.add(ValidationErrors.pageNotImported(ownerName, true, line));
                return;
            }
            List<ActionDefinition> actions = definitions.actionsOf(ownerName);
            Optional<ActionDefinition> action = actions.stream()
                .filter(candidate -> candidate.name().equals(call.action()))
                .findFirst();
            if (action.isEmpty()) {
                diagnostics.add(ValidationErrors.undefinedAction(ownerName, call.action(), line,
                    NameUtils.findSimilar(call.action(), actionNames(actions))));
                return;
            }
            checkArity(ownerName, action.get(), call, line);
            return;
        }

        List<String> owners = new ArrayList<>();
        if (owner != null) {
            owners.add(owner.name());
        }
        owners.addAll(visible);
        List<ActionDefinition> candidates = new ArrayList<>();
        for (String candidateOwner : owners) {
            for (ActionDefinition action : definitions.actionsOf(candidateOwner)) {
                if (action.name().equals(call.action())) {
                    checkArity(candidateOwner, action, call, line);
                    return;
                }
                candidates.add(action);
            }
        }
        diagnostics.add(ValidationErrors.undefinedAction(null, call.action(), line,
            NameUtils.findSimilar(call.action(), actionNames(candidates))));
    }

    private void checkArity(String ownerName, ActionDefinition action, ActionCall call, int line) {
        if (action.parameters().size() != call.arguments().size()) {
            diagnostics.add(ValidationErrors.wrongArgumentCount(ownerName, action.name(),
                action.parameters().size(), call.arguments().size(), line));
        }
    }

    private void checkTabAllowed(int line) {
        if (tabRestriction != null) {
            diagnostics.add(ValidationErrors.tabOperationNotAllowed(tabRestriction, line));
        }
    }

    private void bind(String name) {
        scope.add(name);
    }

    private static List<String> fieldNames(List<Page> pages) {
        return pages.stream().flatMap(page -> page.fields().stream()).map(Field::name).toList();
    }

    private static List<String> variableNames(List<Page> pages) {
        List<String> names = new ArrayList<>();
        for (Page page : pages) {
            page.variables().stream().map(Variable::name).forEach(names::add);
            page.fields().stream().map(Field::name).forEach(names::add);
        }
        return names;
    }

    private static List<String> actionNames(List<ActionDefinition> actions) {
        return actions.stream().map(ActionDefinition::name).toList();
    }

    // Statements

    @Override
    public Void visitClickStatement(ClickStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitFillStatement(FillStatement statement) {
        checkTarget(statement.target(), statement.line());
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitOpenStatement(OpenStatement statement) {
        checkExpression(statement.url(), statement.line());
        if (statement.newTab()) {
            checkTabAllowed(statement.line());
        }
        return null;
    }

    @Override
    public Void visitCheckStatement(CheckStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitSelectStatement(SelectStatement statement) {
        checkExpression(statement.option(), statement.line());
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitHoverStatement(HoverStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitPressStatement(PressStatement statement) {
        checkExpression(statement.key(), statement.line());
        return null;
    }

    @Override
    public Void visitScrollStatement(ScrollStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitDragStatement(DragStatement statement) {
        checkTarget(statement.source(), statement.line());
        checkTarget(statement.destination(), statement.line());
        return null;
    }

    @Override
    public Void visitUploadStatement(UploadStatement statement) {
        checkExpressions(statement.files(), statement.line());
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitWaitStatement(WaitStatement statement) {
        return null;
    }

    @Override
    public Void visitWaitForElementStatement(WaitForElementStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitWaitForLoadStatement(WaitForLoadStatement statement) {
        return null;
    }

    @Override
    public Void visitWaitForUrlStatement(WaitForUrlStatement statement) {
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitRefreshStatement(RefreshStatement statement) {
        return null;
    }

    @Override
    public Void visitClearStatement(ClearStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitScreenshotStatement(ScreenshotStatement statement) {
        checkTarget(statement.target(), statement.line());
        return null;
    }

    @Override
    public Void visitLogStatement(LogStatement statement) {
        checkExpression(statement.message(), statement.line());
        return null;
    }

    @Override
    public Void visitTabStatement(TabStatement statement) {
        checkTabAllowed(statement.line());
        checkExpression(statement.argument(), statement.line());
        return null;
    }

    @Override
    public Void visitFrameStatement(FrameStatement statement) {
        return null;
    }

    @Override
    public Void visitDialogStatement(DialogStatement statement) {
        checkExpression(statement.response(), statement.line());
        return null;
    }

    @Override
    public Void visitCookieStatement(CookieStatement statement) {
        checkExpression(statement.name(), statement.line());
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitStorageStatement(StorageStatement statement) {
        checkExpression(statement.key(), statement.line());
        checkExpression(statement.value(), statement.line());
        if (statement.variable() != null) {
            bind(statement.variable());
        }
        return null;
    }

    @Override
    public Void visitPerformStatement(PerformStatement statement) {
        checkCall(statement.call(), statement.line());
        if (statement.assignsResult()) {
            bind(statement.resultVariable());
        }
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement statement) {
        checkTarget(statement.target(), statement.line());
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitVerifyElementStatement(VerifyElementStatement statement) {
        checkTarget(statement.target(), statement.line());
        checkExpression(statement.check().value(), statement.line());
        checkExpression(statement.check().attribute(), statement.line());
        return null;
    }

    @Override
    public Void visitVerifyPageStatement(VerifyPageStatement statement) {
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitVerifyVariableStatement(VerifyVariableStatement statement) {
        checkExpression(statement.variable(), statement.line());
        checkExpression(statement.value(), statement.line());
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatement statement) {
        Condition condition = statement.condition();
        if (condition instanceof Condition.ElementStateCondition elementState) {
            checkTarget(elementState.target(), statement.line());
        } else if (condition instanceof Condition.Comparison comparison) {
            checkExpression(comparison.left(), statement.line());
            checkExpression(comparison.right(), statement.line());
        }
        check(statement.thenStatements());
        check(statement.elseStatements());
        return null;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement statement) {
        checkExpression(statement.count(), statement.line());
        check(statement.statements());
        return null;
    }

    @Override
    public Void visitForEachStatement(ForEachStatement statement) {
        if (!scope.contains(statement.collection())) {
            diagnostics.add(ValidationErrors.undefinedCollection(statement.collection(), statement.line()));
        }
        Set<String> outer = scope;
        scope = new LinkedHashSet<>(outer);
        scope.add(statement.item());
        check(statement.statements());
        scope = outer;
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclaration statement) {
        checkExpression(statement.value(), statement.line());
        bind(statement.name());
        return null;
    }

    @Override
    public Void visitLoadStatement(LoadStatement statement) {
        checkDataCondition(statement.where(), statement.line());
        bind(statement.variable());
        return null;
    }

    @Override
    public Void visitDataQueryStatement(DataQueryStatement statement) {
        checkDataCondition(statement.query().where(), statement.line());
        bind(statement.variable());
        return null;
    }
}
