package com.verolang.core.validator;

import com.verolang.core.ast.Page;
import com.verolang.core.ast.PageActions;
import com.verolang.core.ast.Program;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarations from sibling files of the same project, visible to the file being validated.
 *
 * <p>The context is read-only input; one instance can be shared by concurrent validations.
 *
 * @param pages pages declared elsewhere
 * @param pageActions page actions libraries declared elsewhere
 */
public record ValidationContext(List<Page> pages, List<PageActions> pageActions) {

    public ValidationContext {
        pages = pages == null ? List.of() : List.copyOf(pages);
        pageActions = pageActions == null ? List.of() : List.copyOf(pageActions);
    }

    public static ValidationContext empty() {
        return new ValidationContext(List.of(), List.of());
    }

    /**
     * Collects the pages and page actions of already parsed sibling programs.
     */
    public static ValidationContext of(List<Program> programs) {
        List<Page> pages = new ArrayList<>();
        List<PageActions> pageActions = new ArrayList<>();
        for (Program program : programs) {
            pages.addAll(program.pages());
            pageActions.addAll(program.pageActions());
        }
        return new ValidationContext(pages, pageActions);
    }

    public boolean isEmpty() {
        return pages.isEmpty() && pageActions.isEmpty();
    }
}
