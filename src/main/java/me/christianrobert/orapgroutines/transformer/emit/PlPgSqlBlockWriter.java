package me.christianrobert.orapgroutines.transformer.emit;

import me.christianrobert.orapgroutines.core.tools.TypeConverter;
import me.christianrobert.orapgroutines.transformer.model.CursorDeclaration;
import me.christianrobert.orapgroutines.transformer.model.Declaration;
import me.christianrobert.orapgroutines.transformer.model.PlSqlBlock;
import me.christianrobert.orapgroutines.transformer.model.RoutineParameter;
import me.christianrobert.orapgroutines.transformer.model.VariableDeclaration;
import me.christianrobert.orapgroutines.transformer.model.statement.BlockStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.ControlRole;
import me.christianrobert.orapgroutines.transformer.model.statement.OtherStatement;
import me.christianrobert.orapgroutines.transformer.model.statement.PlSqlStatement;
import me.christianrobert.orapgroutines.transformer.model.token.SqlToken;

import java.util.List;

/**
 * Renders a block as PL/pgSQL text.
 *
 * Declarations are rewritten into PL/pgSQL form (cursor declarations, converted types);
 * statements are printed as their tokens, indented by two spaces per nesting level.
 */
public class PlPgSqlBlockWriter {

    private static final String INDENT = "  ";

    /**
     * Renders {@code [DECLARE ...] BEGIN ... END;} without trailing newline.
     */
    public String write(PlSqlBlock block) {
        StringBuilder sb = new StringBuilder();
        writeBlock(sb, block, 0);
        return sb.toString();
    }

    private void writeBlock(StringBuilder sb, PlSqlBlock block, int baseDepth) {
        if (!block.getDeclarations().isEmpty()) {
            line(sb, baseDepth, "DECLARE");
            for (Declaration declaration : block.getDeclarations()) {
                line(sb, baseDepth + 1, renderDeclaration(declaration));
            }
        }
        line(sb, baseDepth, "BEGIN");
        writeStatements(sb, block.getStatements(), baseDepth);
        indent(sb, baseDepth);
        sb.append("END;");
    }

    private void writeStatements(StringBuilder sb, List<PlSqlStatement> statements, int baseDepth) {
        int depth = baseDepth + 1;
        for (PlSqlStatement statement : statements) {
            if (statement instanceof BlockStatement) {
                writeBlock(sb, ((BlockStatement) statement).getBlock(), depth);
                sb.append('\n');
                continue;
            }

            ControlRole role = statement instanceof OtherStatement
                    ? ((OtherStatement) statement).getControlRole()
                    : ControlRole.NONE;
            String text = statement.getText();
            switch (role) {
                case OPENS:
                    line(sb, depth, text);
                    depth++;
                    break;
                case CONTINUES:
                    line(sb, Math.max(baseDepth + 1, depth - 1), text);
                    break;
                case CLOSES:
                    depth = Math.max(baseDepth + 1, depth - 1);
                    line(sb, depth, text);
                    break;
                case EXCEPTION_SECTION:
                    line(sb, baseDepth, text);
                    depth = baseDepth + 1;
                    break;
                case HANDLER:
                    line(sb, baseDepth + 1, text);
                    depth = baseDepth + 2;
                    break;
                case LABEL:
                case NONE:
                default:
                    line(sb, depth, text);
                    break;
            }
        }
    }

    String renderDeclaration(Declaration declaration) {
        if (declaration instanceof CursorDeclaration) {
            return renderCursor((CursorDeclaration) declaration);
        }
        if (declaration instanceof VariableDeclaration) {
            return renderVariable((VariableDeclaration) declaration);
        }
        return SqlToken.join(declaration.getTokens());
    }

    private String renderCursor(CursorDeclaration cursor) {
        StringBuilder sb = new StringBuilder(cursor.getName()).append(" CURSOR");
        if (!cursor.getParameters().isEmpty()) {
            sb.append(" (");
            for (int i = 0; i < cursor.getParameters().size(); i++) {
                RoutineParameter parameter = cursor.getParameters().get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(parameter.getName()).append(' ').append(TypeConverter.toPostgre(parameter.getDataType()));
            }
            sb.append(')');
        }
        sb.append(" FOR ").append(SqlToken.join(cursor.getQueryTokens())).append(';');
        return sb.toString();
    }

    private String renderVariable(VariableDeclaration variable) {
        StringBuilder sb = new StringBuilder(variable.getName());
        if (variable.isConstant()) {
            sb.append(" CONSTANT");
        }
        sb.append(' ').append(TypeConverter.toPostgre(variable.getDataType()));
        if (variable.isNotNull()) {
            sb.append(" NOT NULL");
        }
        if (variable.hasDefault()) {
            sb.append(" := ").append(SqlToken.join(variable.getDefaultTokens()));
        }
        sb.append(';');
        return sb.toString();
    }

    private static void line(StringBuilder sb, int depth, String text) {
        indent(sb, depth);
        sb.append(text).append('\n');
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }
}
