package me.christianrobert.orapgroutines.transformer.emit;

import me.christianrobert.orapgroutines.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.orapgroutines.core.tools.TypeConverter;
import me.christianrobert.orapgroutines.transformer.context.RoutineTranslationResult;
import me.christianrobert.orapgroutines.transformer.cursor.AttributeReferenceSite;
import me.christianrobert.orapgroutines.transformer.cursor.TransformedRoutine;
import me.christianrobert.orapgroutines.transformer.model.OraclePackage;
import me.christianrobert.orapgroutines.transformer.model.ParameterMode;
import me.christianrobert.orapgroutines.transformer.model.RoutineParameter;
import me.christianrobert.orapgroutines.transformer.model.RoutineSignature;
import me.christianrobert.orapgroutines.transformer.visibility.RoutineVisibility;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders a transformed routine as a {@code CREATE OR REPLACE FUNCTION|PROCEDURE}
 * statement. Private routines are followed by a {@code REVOKE ALL ... FROM <grantee>}
 * so only the package's own routines (running as owner) keep calling them.
 */
public class RoutineEmitter {

    private static final Logger log = LoggerFactory.getLogger(RoutineEmitter.class);

    private final RoutineNaming naming;
    private final String revokeGrantee;
    private final PlPgSqlBlockWriter blockWriter = new PlPgSqlBlockWriter();

    public RoutineEmitter(RoutineNaming naming, String revokeGrantee) {
        this.naming = Objects.requireNonNull(naming, "naming");
        this.revokeGrantee = revokeGrantee == null || revokeGrantee.isBlank() ? "PUBLIC" : revokeGrantee.trim();
    }

    public RoutineTranslationResult emit(OraclePackage owner, TransformedRoutine routine, RoutineVisibility visibility) {
        String targetName = naming.qualifiedName(owner.getSchema(), owner.getName(), routine.getName());
        String sql = render(targetName, routine, visibility);

        List<String> unresolved = new ArrayList<>();
        for (AttributeReferenceSite site : routine.getUnresolvedReferences()) {
            unresolved.add(site.getCursorName() + "%" + site.getAttribute());
        }

        log.debug("Emitted {} as {} ({})", routine.getName(), targetName, visibility);
        return RoutineTranslationResult.success(routine.getName(), targetName, visibility, sql,
                routine.getRewrittenReferenceCount(), unresolved);
    }

    String render(String targetName, TransformedRoutine routine, RoutineVisibility visibility) {
        RoutineSignature signature = routine.getSignature();
        String keyword = signature.isFunction() ? "FUNCTION" : "PROCEDURE";
        String body = blockWriter.write(routine.getBody());
        String quote = body.contains("$$") ? "$body$" : "$$";

        StringBuilder sb = new StringBuilder();
        sb.append("CREATE OR REPLACE ").append(keyword).append(' ').append(targetName)
                .append('(').append(renderParameters(signature)).append(")\n");
        if (signature.isFunction() && signature.getReturnType() != null) {
            sb.append("RETURNS ").append(TypeConverter.toPostgre(signature.getReturnType())).append('\n');
        }
        sb.append("LANGUAGE plpgsql\n");
        sb.append("AS ").append(quote).append('\n');
        sb.append(body).append('\n');
        sb.append(quote).append(";\n");

        if (visibility == RoutineVisibility.PRIVATE) {
            sb.append('\n')
                    .append("REVOKE ALL ON ").append(keyword).append(' ').append(targetName)
                    .append('(').append(renderArgumentTypes(signature)).append(')')
                    .append(" FROM ").append(revokeGrantee).append(";\n");
        }
        return sb.toString();
    }

    private static String renderParameters(RoutineSignature signature) {
        StringBuilder sb = new StringBuilder();
        for (RoutineParameter parameter : signature.getParameters()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            if (parameter.getMode() != ParameterMode.IN) {
                sb.append(parameter.getMode().getPostgresKeyword()).append(' ');
            }
            sb.append(PostgresIdentifierNormalizer.normalizeIdentifier(parameter.getName()))
                    .append(' ')
                    .append(TypeConverter.toPostgre(parameter.getDataType()));
            if (parameter.getDefaultValue() != null) {
                sb.append(" DEFAULT ").append(parameter.getDefaultValue());
            }
        }
        return sb.toString();
    }

    /**
     * Argument types identifying the routine. OUT parameters are not part of a
     * function's identity, but they are for procedures.
     */
    private static String renderArgumentTypes(RoutineSignature signature) {
        StringBuilder sb = new StringBuilder();
        for (RoutineParameter parameter : signature.getParameters()) {
            if (signature.isFunction() && parameter.getMode() == ParameterMode.OUT) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(TypeConverter.toPostgre(parameter.getDataType()));
        }
        return sb.toString();
    }
}
