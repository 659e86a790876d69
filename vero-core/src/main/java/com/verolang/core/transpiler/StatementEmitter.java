package com.verolang.core.transpiler;

import com.verolang.core.ast.Condition;
import com.verolang.core.ast.ElementState;
import com.verolang.core.ast.Expression;
import com.verolang.core.ast.Target;
import com.verolang.core.ast.VariableReference;
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
import com.verolang.core.ast.statement.TextMatch;
import com.verolang.core.ast.statement.UploadStatement;
import com.verolang.core.ast.statement.VariableDeclaration;
import com.verolang.core.ast.statement.VerifyElementStatement;
import com.verolang.core.ast.statement.VerifyPageStatement;
import com.verolang.core.ast.statement.VerifyVariableStatement;
import com.verolang.core.ast.statement.WaitForElementStatement;
import com.verolang.core.ast.statement.WaitForLoadStatement;
import com.verolang.core.ast.statement.WaitForUrlStatement;
import com.verolang.core.ast.statement.WaitStatement;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes the TypeScript for one body: an action method, a hook or a test.
 */
final class StatementEmitter implements StatementVisitor<Void> {

    private static final int SCROLL_STEP = 500;

    private final CodeWriter out;
    private final Resolver resolver;
    private final DataQueries queries;
    private EmitScope scope;
    private int loops;
    private int frames;

    StatementEmitter(CodeWriter out, Resolver resolver, EmitScope scope) {
        this.out = out;
        this.resolver = resolver;
        this.scope = scope;
        this.queries = new DataQueries(expression -> resolver.expression(expression, this.scope));
    }

    void emit(List<Statement> statements) {
        for (Statement statement : statements) {
            statement.accept(this);
        }
    }

    private void emitBlock(List<Statement> statements) {
        EmitScope saved = scope;
        scope = scope.child();
        try {
            emit(statements);
        } finally {
            scope = saved;
        }
    }

    private String locator(Target target) {
        return resolver.locator(target, scope);
    }

    private String value(Expression expression) {
        return resolver.expression(expression, scope);
    }

    private String text(Expression expression) {
        return resolver.text(expression, scope);
    }

    private String page() {
        return scope.page();
    }

    // Actions

    @Override
    public Void visitClickStatement(ClickStatement statement) {
        String options = switch (statement.clickType()) {
            case SINGLE -> ".click()";
            case DOUBLE -> ".dblclick()";
            case RIGHT -> ".click({ button: 'right' })";
            case FORCE -> ".click({ force: true })";
        };
        out.line("await " + locator(statement.target()) + options + ";");
        return null;
    }

    @Override
    public Void visitFillStatement(FillStatement statement) {
        out.line("await " + locator(statement.target()) + ".fill(" + text(statement.value()) + ");");
        return null;
    }

    @Override
    public Void visitOpenStatement(OpenStatement statement) {
        if (statement.newTab()) {
            requireTabs("OPEN ... IN NEW TAB");
            out.line("page = await page.context().newPage();");
            reinstantiatePages();
        }
        out.line("await " + page() + ".goto(" + text(statement.url()) + ");");
        return null;
    }

    @Override
    public Void visitCheckStatement(CheckStatement statement) {
        out.line("await " + locator(statement.target()) + (statement.checked() ? ".check();" : ".uncheck();"));
        return null;
    }

    @Override
    public Void visitSelectStatement(SelectStatement statement) {
        out.line("await " + locator(statement.target()) + ".selectOption(" + text(statement.option()) + ");");
        return null;
    }

    @Override
    public Void visitHoverStatement(HoverStatement statement) {
        out.line("await " + locator(statement.target()) + ".hover();");
        return null;
    }

    @Override
    public Void visitPressStatement(PressStatement statement) {
        out.line("await " + page() + ".keyboard.press(" + text(statement.key()) + ");");
        return null;
    }

    @Override
    public Void visitScrollStatement(ScrollStatement statement) {
        if (statement.target() != null) {
            out.line("await " + locator(statement.target()) + ".scrollIntoViewIfNeeded();");
            return null;
        }
        String delta = switch (statement.direction()) {
            case UP -> "0, -" + SCROLL_STEP;
            case DOWN -> "0, " + SCROLL_STEP;
            case LEFT -> "-" + SCROLL_STEP + ", 0";
            case RIGHT -> SCROLL_STEP + ", 0";
        };
        out.line("await " + page() + ".mouse.wheel(" + delta + ");");
        return null;
    }

    @Override
    public Void visitDragStatement(DragStatement statement) {
        String source = locator(statement.source());
        if (statement.destination() != null) {
            out.line("await " + source + ".dragTo(" + locator(statement.destination()) + ");");
            return null;
        }
        out.open("{");
        out.line("const __box__ = await " + source + ".boundingBox();");
        out.open("if (!__box__) {");
        out.line("throw new Error(" + TypeScript.quote("Cannot drag " + statement.source().describe()
            + ": element has no bounding box") + ");");
        out.close("}");
        out.line("const __x__ = __box__.x + __box__.width / 2;");
        out.line("const __y__ = __box__.y + __box__.height / 2;");
        out.line("await " + page() + ".mouse.move(__x__, __y__);");
        out.line("await " + page() + ".mouse.down();");
        out.line("await " + page() + ".mouse.move(__x__ + " + statement.x() + ", __y__ + " + statement.y() + ");");
        out.line("await " + page() + ".mouse.up();");
        out.close("}");
        return null;
    }

    @Override
    public Void visitUploadStatement(UploadStatement statement) {
        String files = statement.files().stream().map(this::text).collect(Collectors.joining(", "));
        out.line("await " + locator(statement.target()) + ".setInputFiles([" + files + "]);");
        return null;
    }

    @Override
    public Void visitWaitStatement(WaitStatement statement) {
        out.line("await " + page() + ".waitForTimeout(" + statement.toMillis() + ");");
        return null;
    }

    @Override
    public Void visitWaitForElementStatement(WaitForElementStatement statement) {
        out.line("await " + locator(statement.target()) + ".waitFor({ state: 'visible' });");
        return null;
    }

    @Override
    public Void visitWaitForLoadStatement(WaitForLoadStatement statement) {
        String state = switch (statement.state()) {
            case NAVIGATION -> "'load'";
            case NETWORK_IDLE -> "'networkidle'";
        };
        out.line("await " + page() + ".waitForLoadState(" + state + ");");
        return null;
    }

    @Override
    public Void visitWaitForUrlStatement(WaitForUrlStatement statement) {
        out.line("await " + page() + ".waitForURL(" + urlMatcher(statement.match(), statement.value()) + ");");
        return null;
    }

    @Override
    public Void visitRefreshStatement(RefreshStatement statement) {
        out.line("await " + page() + ".reload();");
        return null;
    }

    @Override
    public Void visitClearStatement(ClearStatement statement) {
        out.line("await " + locator(statement.target()) + ".clear();");
        return null;
    }

    @Override
    public Void visitScreenshotStatement(ScreenshotStatement statement) {
        String path = statement.filename() == null ? "" : "path: " + TypeScript.quote(statement.filename());
        if (statement.target() != null) {
            String options = path.isEmpty() ? "" : "{ " + path + " }";
            out.line("await " + locator(statement.target()) + ".screenshot(" + options + ");");
        } else {
            String options = path.isEmpty() ? "{ fullPage: true }" : "{ " + path + ", fullPage: true }";
            out.line("await " + page() + ".screenshot(" + options + ");");
        }
        return null;
    }

    @Override
    public Void visitLogStatement(LogStatement statement) {
        out.line("console.log(" + value(statement.message()) + ");");
        return null;
    }

    @Override
    public Void visitTabStatement(TabStatement statement) {
        requireTabs("tab switching");
        switch (statement.action()) {
            case SWITCH_TO_NEW -> {
                if (statement.argument() != null) {
                    out.line("page = await page.context().newPage();");
                    out.line("await page.goto(" + text(statement.argument()) + ");");
                } else {
                    out.line("page = page.context().pages()[page.context().pages().length - 1];");
                }
            }
            case SWITCH_TO -> out.line("page = page.context().pages()[Number(" + value(statement.argument()) + ") - 1];");
            case CLOSE -> {
                out.line("await page.close();");
                out.line("page = page.context().pages()[page.context().pages().length - 1];");
            }
        }
        out.line("await page.bringToFront();");
        reinstantiatePages();
        return null;
    }

    @Override
    public Void visitFrameStatement(FrameStatement statement) {
        if (statement.isMainFrame()) {
            scope.leaveFrame();
            return null;
        }
        String local = "__frame" + (++frames) + "__";
        String selector = statement.frame().value();
        out.line("const " + local + " = " + page() + ".frameLocator(" + TypeScript.quote(selector) + ");");
        scope.enterFrame(local);
        return null;
    }

    @Override
    public Void visitDialogStatement(DialogStatement statement) {
        if (!statement.accept()) {
            out.line(page() + ".once('dialog', (dialog) => dialog.dismiss());");
        } else if (statement.response() != null) {
            out.line(page() + ".once('dialog', (dialog) => dialog.accept(" + text(statement.response()) + "));");
        } else {
            out.line(page() + ".once('dialog', (dialog) => dialog.accept());");
        }
        return null;
    }

    @Override
    public Void visitCookieStatement(CookieStatement statement) {
        if (statement.action() == CookieStatement.Action.CLEAR) {
            out.line("await " + page() + ".context().clearCookies();");
        } else {
            out.line("await " + page() + ".context().addCookies([{ name: " + text(statement.name())
                + ", value: " + text(statement.value()) + ", url: " + page() + ".url() }]);");
        }
        return null;
    }

    @Override
    public Void visitStorageStatement(StorageStatement statement) {
        switch (statement.action()) {
            case SET -> out.line("await " + page() + ".evaluate(([key, value]) => localStorage.setItem(key, value), ["
                + text(statement.key()) + ", " + text(statement.value()) + "]);");
            case GET -> {
                String key = text(statement.key());
                out.line(scope.declare(statement.variable()) + statement.variable() + " = await " + page()
                    + ".evaluate((key) => localStorage.getItem(key), " + key + ");");
            }
            case CLEAR -> out.line("await " + page() + ".evaluate(() => localStorage.clear());");
        }
        return null;
    }

    @Override
    public Void visitPerformStatement(PerformStatement statement) {
        String call = "await " + resolver.call(statement.call(), scope) + ";";
        if (statement.assignsResult()) {
            out.line(scope.declare(statement.resultVariable()) + statement.resultVariable() + " = " + call);
        } else {
            out.line(call);
        }
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatement statement) {
        switch (statement.kind()) {
            case NOTHING -> out.line("return;");
            case EXPRESSION -> out.line("return " + value(statement.value()) + ";");
            case VISIBLE_OF -> out.line("return await " + locator(statement.target()) + ".isVisible();");
            case TEXT_OF -> out.line("return (await " + locator(statement.target()) + ".textContent()) ?? '';");
            case VALUE_OF -> out.line("return await " + locator(statement.target()) + ".inputValue();");
        }
        return null;
    }

    // Assertions

    @Override
    public Void visitVerifyElementStatement(VerifyElementStatement statement) {
        VerifyElementStatement.Check check = statement.check();
        String not = statement.negated() ? ".not" : "";

        String variable = resolver.valueOf(statement.target(), scope);
        if (variable != null && isTextCheck(check.kind())) {
            String matcher = check.kind() == VerifyElementStatement.Kind.CONTAINS ? ".toContain(" : ".toBe(";
            out.line("expect(String(" + variable + "))" + not + matcher + text(check.value()) + ");");
            return null;
        }

        String subject = "await expect(" + locator(statement.target()) + ")" + not;
        String assertion = switch (check.kind()) {
            case STATE -> stateMatcher(check.state()) + "()";
            case CONTAINS -> ".toContainText(" + text(check.value()) + ")";
            case HAS_TEXT -> ".toHaveText(" + text(check.value()) + ")";
            case HAS_VALUE -> ".toHaveValue(" + text(check.value()) + ")";
            case HAS_ATTRIBUTE -> ".toHaveAttribute(" + text(check.attribute()) + ", " + text(check.value()) + ")";
            case HAS_COUNT -> ".toHaveCount(Number(" + value(check.value()) + "))";
            case HAS_CLASS -> ".toHaveClass(new RegExp('(^|\\\\s)' + __escapeRegExp__("
                + text(check.value()) + ") + '(\\\\s|$)'))";
        };
        out.line(subject + assertion + ";");
        return null;
    }

    private static boolean isTextCheck(VerifyElementStatement.Kind kind) {
        return kind == VerifyElementStatement.Kind.CONTAINS
            || kind == VerifyElementStatement.Kind.HAS_TEXT
            || kind == VerifyElementStatement.Kind.HAS_VALUE;
    }

    private static String stateMatcher(ElementState state) {
        return switch (state) {
            case VISIBLE -> ".toBeVisible";
            case HIDDEN -> ".toBeHidden";
            case ENABLED -> ".toBeEnabled";
            case DISABLED -> ".toBeDisabled";
            case CHECKED -> ".toBeChecked";
            case FOCUSED -> ".toBeFocused";
            case EMPTY -> ".toBeEmpty";
        };
    }

    @Override
    public Void visitVerifyPageStatement(VerifyPageStatement statement) {
        String matcher = statement.subject() == VerifyPageStatement.Subject.URL ? ".toHaveURL(" : ".toHaveTitle(";
        out.line("await expect(" + page() + ")" + matcher + urlMatcher(statement.match(), statement.value()) + ");");
        return null;
    }

    private String urlMatcher(TextMatch match, Expression value) {
        return switch (match) {
            case CONTAINS -> "new RegExp(__escapeRegExp__(" + text(value) + "))";
            case EQUALS -> text(value);
            case MATCHES -> "new RegExp(" + text(value) + ")";
        };
    }

    @Override
    public Void visitVerifyVariableStatement(VerifyVariableStatement statement) {
        String subject = "expect(" + value(statement.variable()) + ")" + (statement.negated() ? ".not" : "");
        switch (statement.kind()) {
            case IS_TRUE -> out.line(subject + ".toBeTruthy();");
            case IS_FALSE -> out.line(subject + ".toBeFalsy();");
            case EQUALS -> out.line("expect(String(" + value(statement.variable()) + "))"
                + (statement.negated() ? ".not" : "") + ".toBe(" + text(statement.value()) + ");");
        }
        return null;
    }

    // Control flow

    @Override
    public Void visitIfStatement(IfStatement statement) {
        out.open("if (" + condition(statement.condition()) + ") {");
        emitBlock(statement.thenStatements());
        if (statement.elseStatements().isEmpty()) {
            out.close("}");
            return null;
        }
        out.reopen("} else {");
        emitBlock(statement.elseStatements());
        out.close("}");
        return null;
    }

    private String condition(Condition condition) {
        if (condition instanceof Condition.Comparison comparison) {
            return value(comparison.left()) + " " + comparison.operator().symbol() + " " + value(comparison.right());
        }
        Condition.ElementStateCondition element = (Condition.ElementStateCondition) condition;
        String locator = locator(element.target());
        String test = switch (element.state()) {
            case VISIBLE -> "await " + locator + ".isVisible()";
            case HIDDEN -> "await " + locator + ".isHidden()";
            case ENABLED -> "await " + locator + ".isEnabled()";
            case DISABLED -> "await " + locator + ".isDisabled()";
            case CHECKED -> "await " + locator + ".isChecked()";
            case FOCUSED -> "await " + locator + ".evaluate((el) => el === document.activeElement)";
            case EMPTY -> "((await " + locator + ".textContent()) ?? '').trim() === ''";
        };
        return element.negated() ? "!(" + test + ")" : test;
    }

    @Override
    public Void visitRepeatStatement(RepeatStatement statement) {
        String counter = "__i" + (++loops) + "__";
        out.open("for (let " + counter + " = 0; " + counter + " < Number(" + value(statement.count()) + "); "
            + counter + "++) {");
        emitBlock(statement.statements());
        out.close("}");
        return null;
    }

    @Override
    public Void visitForEachStatement(ForEachStatement statement) {
        if (!scope.isVariable(statement.collection())) {
            throw new TranspilerContractException("FOR EACH collection '" + statement.collection()
                + "' is not a variable in scope");
        }
        String collection = value(new VariableReference(null, statement.collection()));
        out.open("for (const " + statement.item() + " of " + collection + ") {");
        EmitScope saved = scope;
        scope = scope.child();
        try {
            scope.bind(statement.item());
            emit(statement.statements());
        } finally {
            scope = saved;
        }
        out.close("}");
        return null;
    }

    // Variables and data

    @Override
    public Void visitVariableDeclaration(VariableDeclaration statement) {
        String value = value(statement.value());
        out.line(scope.declare(statement.name()) + statement.name() + " = " + value + ";");
        return null;
    }

    @Override
    public Void visitLoadStatement(LoadStatement statement) {
        String rows = queries.load(statement.table(), statement.where());
        out.line(scope.declare(statement.variable()) + statement.variable() + " = " + rows + ";");
        return null;
    }

    @Override
    public Void visitDataQueryStatement(DataQueryStatement statement) {
        String query = queries.query(statement.query(), statement.resultType());
        out.line(scope.declare(statement.variable()) + statement.variable() + " = " + query + ";");
        return null;
    }

    // Tabs

    private void requireTabs(String what) {
        if (!scope.tabsAllowed()) {
            throw new TranspilerContractException(what + " is not allowed here");
        }
    }

    /**
     * Page objects hold the page they were built with, so a tab switch rebuilds them.
     */
    private void reinstantiatePages() {
        for (Map.Entry<String, String> entry : scope.instances()) {
            out.line(entry.getValue() + " = new " + TypeScript.className(entry.getKey()) + "(page);");
        }
    }
}
