package com.verolang.core.ast.statement;

/**
 * Visitor over every {@link Statement} kind.
 *
 * @param <R> result type; use {@link Void} for side-effect-only walks
 */
public interface StatementVisitor<R> {

    // Actions
    R visitClickStatement(ClickStatement statement);

    R visitFillStatement(FillStatement statement);

    R visitOpenStatement(OpenStatement statement);

    R visitCheckStatement(CheckStatement statement);

    R visitSelectStatement(SelectStatement statement);

    R visitHoverStatement(HoverStatement statement);

    R visitPressStatement(PressStatement statement);

    R visitScrollStatement(ScrollStatement statement);

    R visitDragStatement(DragStatement statement);

    R visitUploadStatement(UploadStatement statement);

    R visitWaitStatement(WaitStatement statement);

    R visitWaitForElementStatement(WaitForElementStatement statement);

    R visitWaitForLoadStatement(WaitForLoadStatement statement);

    R visitWaitForUrlStatement(WaitForUrlStatement statement);

    R visitRefreshStatement(RefreshStatement statement);

    R visitClearStatement(ClearStatement statement);

    R visitScreenshotStatement(ScreenshotStatement statement);

    R visitLogStatement(LogStatement statement);

    R visitTabStatement(TabStatement statement);

    R visitFrameStatement(FrameStatement statement);

    R visitDialogStatement(DialogStatement statement);

    R visitCookieStatement(CookieStatement statement);

    R visitStorageStatement(StorageStatement statement);

    R visitPerformStatement(PerformStatement statement);

    R visitReturnStatement(ReturnStatement statement);

    // Assertions
    R visitVerifyElementStatement(VerifyElementStatement statement);

    R visitVerifyPageStatement(VerifyPageStatement statement);

    R visitVerifyVariableStatement(VerifyVariableStatement statement);

    // Control flow
    R visitIfStatement(IfStatement statement);

    R visitRepeatStatement(RepeatStatement statement);

    R visitForEachStatement(ForEachStatement statement);

    // Variables and data
    R visitVariableDeclaration(VariableDeclaration statement);

    R visitLoadStatement(LoadStatement statement);

    R visitDataQueryStatement(DataQueryStatement statement);
}
