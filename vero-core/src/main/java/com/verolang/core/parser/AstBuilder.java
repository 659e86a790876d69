package com.verolang.core.parser;

import com.verolang.core.ast.ActionDefinition;
import com.verolang.core.ast.Feature;
import com.verolang.core.ast.Field;
import com.verolang.core.ast.Hook;
import com.verolang.core.ast.Page;
import com.verolang.core.ast.PageActions;
import com.verolang.core.ast.Program;
import com.verolang.core.ast.Scenario;
import com.verolang.core.ast.UseRef;
import com.verolang.core.ast.VarType;
import com.verolang.core.ast.Variable;
import com.verolang.core.ast.statement.Statement;
import com.verolang.core.error.VeroError;
import com.verolang.core.grammar.VeroParser;
import com.verolang.core.parser.ExpressionBuilder.RejectedConstruct;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the parse tree into a {@link Program}.
 *
 * <p>The tree still holds the constructs that failed to parse. A statement, field or page
 * variable is kept only when its whole subtree parsed cleanly; a declaration, scenario, hook or
 * action is kept when its header up to the opening brace did, and then holds whatever of its
 * body survived. The syntax error for every dropped construct has already been reported.
 */
final class AstBuilder {

    private static final Logger log = LoggerFactory.getLogger(AstBuilder.class);

    private final ExpressionBuilder expressions;
    private final StatementBuilder statements;

    AstBuilder(List<VeroError> errors) {
        this.expressions = new ExpressionBuilder(errors);
        this.statements = new StatementBuilder(expressions, new DataQueryBuilder(expressions), this::block);
    }

    Program program(VeroParser.ProgramContext context) {
        List<Page> pages = new ArrayList<>();
        List<PageActions> pageActions = new ArrayList<>();
        List<Feature> features = new ArrayList<>();
        for (VeroParser.DeclarationContext declaration : context.declaration()) {
            if (declaration.pageDeclaration() != null && headerParsed(declaration.pageDeclaration())) {
                pages.add(page(declaration.pageDeclaration()));
            } else if (declaration.pageActionsDeclaration() != null
                && headerParsed(declaration.pageActionsDeclaration())) {
                pageActions.add(pageActions(declaration.pageActionsDeclaration()));
            } else if (declaration.featureDeclaration() != null && headerParsed(declaration.featureDeclaration())) {
                features.add(feature(declaration.featureDeclaration()));
            }
        }
        return new Program(pages, pageActions, features);
    }

    // Declarations

    private Page page(VeroParser.PageDeclarationContext context) {
        List<Field> fields = new ArrayList<>();
        List<Variable> variables = new ArrayList<>();
        List<ActionDefinition> actions = new ArrayList<>();
        for (VeroParser.PageMemberContext member : context.pageMember()) {
            if (member.actionDeclaration() != null) {
                if (headerParsed(member.actionDeclaration())) {
                    actions.add(action(member.actionDeclaration()));
                }
            } else if (parsed(member)) {
                if (member.fieldDeclaration() != null) {
                    build(() -> fields.add(field(member.fieldDeclaration())));
                } else {
                    build(() -> variables.add(pageVariable(member.pageVariable())));
                }
            }
        }
        return new Page(ExpressionBuilder.name(context.name()), fields, variables, actions, line(context));
    }

    private Field field(VeroParser.FieldDeclarationContext context) {
        return new Field(ExpressionBuilder.name(context.name()), expressions.selector(context.selectorExpression()),
            line(context));
    }

    private Variable pageVariable(VeroParser.PageVariableContext context) {
        return new Variable(ExpressionBuilder.varType(context.varType()), ExpressionBuilder.name(context.name()),
            expressions.expression(context.expression()), line(context));
    }

    private ActionDefinition action(VeroParser.ActionDeclarationContext context) {
        List<VeroParser.NameContext> names = context.name();
        List<String> parameters = new ArrayList<>();
        for (VeroParser.NameContext parameter : names.subList(1, names.size())) {
            parameters.add(ExpressionBuilder.name(parameter));
        }
        VarType returnType = context.varType() == null ? null : ExpressionBuilder.varType(context.varType());
        return new ActionDefinition(ExpressionBuilder.name(names.get(0)), parameters, returnType,
            block(context.block()), line(context));
    }

    private PageActions pageActions(VeroParser.PageActionsDeclarationContext context) {
        List<VeroParser.NameContext> names = context.name();
        String forPage = names.size() > 1 ? ExpressionBuilder.name(names.get(1)) : null;
        List<ActionDefinition> actions = new ArrayList<>();
        for (VeroParser.ActionDeclarationContext action : context.actionDeclaration()) {
            if (headerParsed(action)) {
                actions.add(action(action));
            }
        }
        return new PageActions(ExpressionBuilder.name(names.get(0)), forPage, actions, line(context));
    }

    private Feature feature(VeroParser.FeatureDeclarationContext context) {
        List<String> annotations = new ArrayList<>();
        for (VeroParser.AnnotationContext annotation : context.annotation()) {
            annotations.add(ExpressionBuilder.name(annotation.name()).toLowerCase(Locale.ROOT));
        }
        String name = context.STRING() != null ? context.STRING().getText() : ExpressionBuilder.name(context.name());

        List<UseRef> uses = new ArrayList<>();
        List<Hook> hooks = new ArrayList<>();
        List<Scenario> scenarios = new ArrayList<>();
        for (VeroParser.FeatureMemberContext member : context.featureMember()) {
            if (member instanceof VeroParser.UseMemberContext use) {
                if (parsed(use)) {
                    uses.add(new UseRef(ExpressionBuilder.name(use.name()), line(use)));
                }
            } else if (member instanceof VeroParser.HookMemberContext hook) {
                if (headerParsed(hook)) {
                    hooks.add(hook(hook));
                }
            } else if (member instanceof VeroParser.ScenarioMemberContext scenario && headerParsed(scenario)) {
                scenarios.add(scenario(scenario));
            }
        }
        return new Feature(name, annotations, uses, hooks, scenarios, context.FEATURE().getSymbol().getLine());
    }

    private Hook hook(VeroParser.HookMemberContext context) {
        boolean before = context.BEFORE() != null;
        Hook.Type type;
        if (context.ALL() != null) {
            type = before ? Hook.Type.BEFORE_ALL : Hook.Type.AFTER_ALL;
        } else {
            type = before ? Hook.Type.BEFORE_EACH : Hook.Type.AFTER_EACH;
        }
        return new Hook(type, block(context.block()), line(context));
    }

    private Scenario scenario(VeroParser.ScenarioMemberContext context) {
        String name = context.STRING() != null ? context.STRING().getText() : ExpressionBuilder.name(context.name());
        List<String> tags = new ArrayList<>();
        for (VeroParser.TagContext tag : context.tag()) {
            tags.add(ExpressionBuilder.name(tag.name()));
        }
        return new Scenario(name, tags, block(context.block()), line(context));
    }

    // Blocks

    List<Statement> block(VeroParser.BlockContext context) {
        List<Statement> built = new ArrayList<>();
        for (VeroParser.StatementContext statement : context.statement()) {
            if (parsed(statement)) {
                build(() -> built.add(statements.visit(statement)));
            }
        }
        return built;
    }

    /**
     * Runs one construct's builder; a rejected construct has reported its error and is skipped.
     */
    private static void build(Runnable builder) {
        try {
            builder.run();
        } catch (RejectedConstruct e) {
            log.trace("Dropped construct: {}", e.getMessage());
        }
    }

    // Parse tree checks

    /**
     * Whether {@code context} and everything below it parsed without errors. Nested blocks are
     * not inspected: their statements are checked one by one when the block is built.
     */
    static boolean parsed(ParserRuleContext context) {
        if (context.exception != null) {
            return false;
        }
        if (context.children == null) {
            return true;
        }
        for (ParseTree child : context.children) {
            if (child instanceof ErrorNode) {
                return false;
            }
            if (child instanceof VeroParser.BlockContext) {
                continue;
            }
            if (child instanceof ParserRuleContext rule && !parsed(rule)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Whether the part of a declaration or member before its body parsed, including the opening
     * brace.
     */
    static boolean headerParsed(ParserRuleContext context) {
        if (context.children == null) {
            return false;
        }
        for (ParseTree child : context.children) {
            if (child instanceof ErrorNode) {
                return false;
            }
            if (child instanceof VeroParser.BlockContext block) {
                return opensBrace(block);
            }
            if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == VeroParser.LBRACE) {
                return true;
            }
            if (child instanceof ParserRuleContext rule && !parsed(rule)) {
                return false;
            }
        }
        return false;
    }

    private static boolean opensBrace(VeroParser.BlockContext block) {
        if (block.children == null) {
            return false;
        }
        for (ParseTree child : block.children) {
            if (child instanceof ErrorNode) {
                return false;
            }
            if (child instanceof TerminalNode terminal && terminal.getSymbol().getType() == VeroParser.LBRACE) {
                return true;
            }
        }
        return false;
    }

    private static int line(ParserRuleContext context) {
        return context.getStart().getLine();
    }
}
