/*
 * Copyright 2015-2023 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package uk.co.real_logic.nifgen.schema.generation;

import uk.co.real_logic.nifgen.schema.Names;
import uk.co.real_logic.nifgen.schema.SchemaContext;
import uk.co.real_logic.nifgen.schema.UnresolvedReferenceException;
import uk.co.real_logic.nifgen.schema.expression.Expression;
import uk.co.real_logic.nifgen.schema.expression.SymbolRef;
import uk.co.real_logic.nifgen.schema.expression.SymbolRenderer;
import uk.co.real_logic.nifgen.schema.ir.BlockType;
import uk.co.real_logic.nifgen.schema.ir.CompoundType;
import uk.co.real_logic.nifgen.schema.ir.Field;
import uk.co.real_logic.nifgen.schema.ir.TypeEntity;
import uk.co.real_logic.nifgen.schema.ir.Version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.RESOLUTION;
import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.isBracketed;
import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.memberName;
import static uk.co.real_logic.nifgen.schema.generation.GenerationUtil.spaces;

/**
 * Generates the body of a member function that streams over every field of a type, for one of the
 * {@link Action}s.
 * <p>
 * Consecutive fields with the same version constraints share one version guard, and within it consecutive
 * fields with the same presence condition share one condition guard. Arrays become loops, compounds implemented
 * by the generator are streamed field by field with their member access as prefix and natively implemented
 * types are streamed by a single runtime call.
 * <p>
 * Symbolic names in expressions resolve first against the fields of the type being streamed, including
 * inherited ones, then against the fields of each enclosing compound. <code>ARG</code> is the value the
 * enclosing field passes as argument.
 */
public final class StreamEmitter
{
    private static final String MAX_ARRAY_DUMP_CHECK = "if ( !verbose && ( array_output_count > MAXARRAYDUMP ) ) {";

    private final SchemaContext context;
    private final Set<String> rootCompounds;
    private final boolean allowUnresolvedReferences;

    /**
     * @param context the loaded schema.
     * @param rootCompounds compounds that are streamed by functions of their own, like blocks, and so declare
     *                      their local variables and return their result.
     * @param allowUnresolvedReferences true to render a name that resolves nowhere as a bare member name, false
     *                                  to fail with an {@link UnresolvedReferenceException}.
     */
    public StreamEmitter(
        final SchemaContext context,
        final Collection<String> rootCompounds,
        final boolean allowUnresolvedReferences)
    {
        this.context = context;
        this.rootCompounds = new HashSet<>(rootCompounds);
        this.allowUnresolvedReferences = allowUnresolvedReferences;
    }

    public String emit(final CompoundType type, final Action action)
    {
        final CodeWriter writer = new CodeWriter();
        emit(type, action, writer);
        return writer.toString();
    }

    public void emit(final CompoundType type, final Action action, final CodeWriter writer)
    {
        emit(type, action, "", "", writer);
    }

    /**
     * Stream over the fields of a type.
     *
     * @param type the type whose fields are streamed.
     * @param action the generated function.
     * @param namePrefix qualifies the type's fields in diagnostics, eg: <code>header_</code>.
     * @param accessPrefix the member access to the fields, eg: <code>header.</code>, empty inside the type's own
     *                     member functions.
     * @param writer the function body being written.
     */
    public void emit(
        final CompoundType type,
        final Action action,
        final String namePrefix,
        final String accessPrefix,
        final CodeWriter writer)
    {
        final boolean isRoot = isRoot(type);
        if (isRoot)
        {
            declareLocals(type, action, writer);
        }

        if (type instanceof BlockType)
        {
            final BlockType parent = ((BlockType)type).parent();
            if (parent != null)
            {
                writer.code(action.parentCall(context.className(parent.name())));
            }
        }

        final Set<CompoundType> active = Collections.newSetFromMap(new IdentityHashMap<>());
        active.add(type);
        stream(new Scope(type, namePrefix, accessPrefix, null, null), action, writer, active);

        if (isRoot)
        {
            returnResult(action, writer);
        }
    }

    boolean isRoot(final CompoundType type)
    {
        return type instanceof BlockType || rootCompounds.contains(type.name());
    }

    private void declareLocals(final CompoundType type, final Action action, final CodeWriter writer)
    {
        switch (action)
        {
            case READ:
                if (type.hasReferences())
                {
                    writer.code("unsigned int block_num;");
                }
                break;

            case DESCRIBE:
                writer.code("stringstream out;");
                if (type.hasArrays())
                {
                    writer.code("unsigned int array_output_count = 0;");
                }
                break;

            case GET_REFS:
                writer.code("list<Ref<NiObject> > refs;");
                break;

            case GET_PTRS:
                writer.code("list<NiObject *> ptrs;");
                break;

            default:
                break;
        }
    }

    private static void returnResult(final Action action, final CodeWriter writer)
    {
        switch (action)
        {
            case DESCRIBE:
                writer.code("return out.str();");
                break;

            case GET_REFS:
                writer.code("return refs;");
                break;

            case GET_PTRS:
                writer.code("return ptrs;");
                break;

            default:
                break;
        }
    }

    private void stream(
        final Scope scope, final Action action, final CodeWriter writer, final Set<CompoundType> active)
    {
        if (action.updatesDerivedValues())
        {
            updateDerivedValues(scope, action, writer);
        }

        final Guards guards = new Guards(writer);
        for (final Field field : scope.type.fields())
        {
            final TypeEntity type = field.type();
            if (action.visitsReferencesOnly() && !type.hasReferences())
            {
                continue;
            }
            if (action == Action.DESCRIBE && field.isDuplicate())
            {
                continue;
            }

            final SymbolRenderer symbols = symbols(scope, field);
            final String condition = field.cond().render(symbols);
            if (action.hasVersionGuards())
            {
                guards.enter(field, field.vercond().render("info.", Names::memberName), condition);
            }
            else if (action.hasConditionGuards())
            {
                guards.enterCondition(condition);
            }

            final String element = openLoops(scope, field, action, symbols, writer);

            if (type.isNative())
            {
                streamNative(scope, field, action, element, writer);
            }
            else
            {
                final CompoundType compound = (CompoundType)type;
                if (!active.add(compound))
                {
                    throw new IllegalStateException(String.format(
                        "Compound %1$s contains itself through %2$s.%3$s (%4$s%5$s)",
                        compound.name(),
                        scope.type.name(),
                        field.name(),
                        scope.namePrefix,
                        memberName(field)));
                }

                final String argument = field.argument() == null ? null : symbols.render(field.argument());
                final Scope nested = new Scope(
                    compound, scope.namePrefix + memberName(field) + "_", element + ".", argument, scope);
                stream(nested, action, writer, active);
                active.remove(compound);
            }

            if (field.isArray())
            {
                writer.code("};");
                if (!field.arr2().isEmpty())
                {
                    writer.code("};");
                }
            }
        }

        guards.close();
    }

    /**
     * Before writing or describing, recompute the values that are derived from other data: function results,
     * calculated values and the sizes of later arrays. Fields are visited last to first.
     */
    private void updateDerivedValues(final Scope scope, final Action action, final CodeWriter writer)
    {
        final CompoundType type = scope.type;
        final String prefix = scope.accessPrefix;
        final List<Field> fields = new ArrayList<>(type.fields());
        Collections.reverse(fields);

        for (final Field field : fields)
        {
            if (field.isDuplicate() || field.isManualUpdate())
            {
                continue;
            }

            final String target = prefix + memberName(field);
            final String className = context.className(field.typeName());
            if (field.function() != null)
            {
                writer.code(target + " = " + prefix + field.function() + "();");
            }
            else if (field.isCalculated())
            {
                if (action == Action.WRITE)
                {
                    writer.code(target + " = " + prefix + memberName(field) + "Calc(info);");
                }
            }
            else if (!field.arr1References().isEmpty())
            {
                if (!field.isArray())
                {
                    final String sized = prefix + sizedMember(type, field, field.arr1References());
                    writer.code(String.format("%1$s = (%2$s)(%3$s.size());", target, className, sized));
                }
            }
            else if (!field.arr2References().isEmpty())
            {
                final String sized = prefix + sizedMember(type, field, field.arr2References());
                if (!field.isArray())
                {
                    writer.code(String.format(
                        "%1$s = (%2$s)((%3$s.size() > 0) ? %3$s[0].size() : 0);", target, className, sized));
                }
                else
                {
                    final int index = writer.indent();
                    writer.code(String.format(
                        "for (unsigned int i%1$d = 0; i%1$d < %2$s.size(); i%1$d++)", index, sized));
                    writer.code(String.format(
                        "\t%1$s[i%2$d] = (%3$s)(%4$s[i%2$d].size());", target, index, className, sized));
                }
            }
        }
    }

    private static String sizedMember(final CompoundType type, final Field size, final List<String> references)
    {
        final Field sized = type.findField(references.get(0), true);
        if (sized == null)
        {
            throw new IllegalStateException(String.format(
                "Field %1$s.%2$s sizes %3$s which isn't declared", type.name(), size.name(), references.get(0)));
        }
        return memberName(sized);
    }

    /**
     * Open a loop per array dimension.
     *
     * @return the expression accessing the value, or the current element of the array.
     */
    private String openLoops(
        final Scope scope,
        final Field field,
        final Action action,
        final SymbolRenderer symbols,
        final CodeWriter writer)
    {
        final String access = scope.accessPrefix + memberName(field);
        if (!field.isArray())
        {
            return access;
        }

        if (action == Action.DESCRIBE)
        {
            writer.code("array_output_count = 0;");
        }

        final String arr1 = field.arr1().render(symbols);
        if (field.arr1().hasStaticSize())
        {
            writer.code(loop(writer.indent(), arr1));
        }
        else
        {
            if (action == Action.READ)
            {
                writer.code(access + ".resize(" + arr1 + ");");
            }
            writer.code(loop(writer.indent(), access + ".size()"));
        }

        if (action == Action.DESCRIBE)
        {
            writer.code(MAX_ARRAY_DUMP_CHECK);
            writer.code("out << \"<Data Truncated. Use verbose mode to see complete listing.>\" << endl;");
            writer.code("break;");
            writer.code("};");
        }

        final Expression arr2Expression = field.arr2();
        if (arr2Expression.isEmpty())
        {
            return access + "[i" + (writer.indent() - 1) + "]";
        }

        final String row = access + "[i" + (writer.indent() - 1) + "]";
        final String arr2 = arr2Expression.render(symbols);
        if (field.isArr2Dynamic())
        {
            final String rowLength = arr2 + "[i" + (writer.indent() - 1) + "]";
            if (action == Action.READ)
            {
                writer.code(row + ".resize(" + rowLength + ");");
            }
            writer.code(loop(writer.indent(), rowLength));
        }
        else if (arr2Expression.hasStaticSize())
        {
            writer.code(loop(writer.indent(), arr2));
        }
        else
        {
            if (action == Action.READ)
            {
                writer.code(row + ".resize(" + arr2 + ");");
            }
            writer.code(loop(writer.indent(), row + ".size()"));
        }

        return access + "[i" + (writer.indent() - 2) + "][i" + (writer.indent() - 1) + "]";
    }

    private static String loop(final int index, final String bound)
    {
        return String.format("for (unsigned int i%1$d = 0; i%1$d < %2$s; i%1$d++) {", index, bound);
    }

    private void streamNative(
        final Scope scope, final Field field, final Action action, final String element, final CodeWriter writer)
    {
        final TypeEntity type = field.type();
        if (action == Action.DESCRIBE)
        {
            describe(field, element, writer);
        }
        else if (!type.isLink() && !type.isCrossRef())
        {
            if (action.streamsValues() && !field.isAbstract())
            {
                streamValue(scope, field, action, element, writer);
            }
        }
        else
        {
            streamReference(field, action, element, writer);
        }
    }

    private void streamValue(
        final Scope scope, final Field field, final Action action, final String element, final CodeWriter writer)
    {
        final String stream = action.stream();
        if ("bool".equals(field.typeName()) && field.isArray())
        {
            // vector<bool> elements aren't addressable
            writer.code("{");
            if (action == Action.READ)
            {
                writer.code("bool tmp;");
                writer.code("NifStream( tmp, " + stream + ", info );");
                writer.code(element + " = tmp;");
            }
            else
            {
                writer.code("bool tmp = " + element + ";");
                writer.code("NifStream( tmp, " + stream + ", info );");
            }
            writer.code("};");
        }
        else if (field.argument() == null)
        {
            final String cast = field.isDuplicate() ? "(" + context.className(field.typeName()) + "&)" : "";
            writer.code("NifStream( " + cast + element + ", " + stream + ", info );");
        }
        else
        {
            final String argument = symbols(scope, field).render(field.argument());
            writer.code("NifStream( " + element + ", " + stream + ", info, " + argument + " );");
        }
    }

    private void streamReference(
        final Field field, final Action action, final String element, final CodeWriter writer)
    {
        final TypeEntity type = field.type();
        switch (action)
        {
            case READ:
                writer.code("NifStream( block_num, in, info );");
                writer.code("link_stack.push_back( block_num );");
                break;

            case WRITE:
                writer.code("WriteRef( StaticCast<NiObject>(" + element + "), out, info, link_map, " +
                    "missing_link_stack );");
                break;

            case FIX_LINKS:
                writer.code(element + " = FixLink<" + templateClassName(field) + ">( objects, link_stack, " +
                    "missing_link_stack, info );");
                break;

            case GET_REFS:
                if (type.isLink() && !field.isDuplicate())
                {
                    writer.code("if ( " + element + " != NULL )\n\trefs.push_back(StaticCast<NiObject>(" +
                        element + "));");
                }
                break;

            case GET_PTRS:
                if (type.isCrossRef() && !field.isDuplicate())
                {
                    writer.code("if ( " + element + " != NULL )\n\tptrs.push_back((NiObject *)(" + element + "));");
                }
                break;

            default:
                break;
        }
    }

    private static void describe(final Field field, final String element, final CodeWriter writer)
    {
        final String padding = spaces(2 * writer.indent());
        if (!field.isArray())
        {
            writer.code("out << \"" + padding + field.name() + ":  \" << " + element + " << endl;");
        }
        else
        {
            writer.code(MAX_ARRAY_DUMP_CHECK);
            writer.code("break;");
            writer.code("};");
            writer.code("out << \"" + padding + field.name() + "[\" << i" + (writer.indent() - 1) + " << \"]:  \" << " +
                element + " << endl;");
            writer.code("array_output_count++;");
        }
    }

    private String templateClassName(final Field field)
    {
        final String className = context.className(field.templateName());
        return className == null ? "" : className;
    }

    private SymbolRenderer symbols(final Scope scope, final Field field)
    {
        return (name) -> resolve(scope, field, name);
    }

    private String resolve(final Scope scope, final Field field, final String name)
    {
        if (SymbolRef.ARGUMENT.equals(name))
        {
            if (scope.argument != null)
            {
                return scope.argument;
            }
        }
        else
        {
            for (Scope enclosing = scope; enclosing != null; enclosing = enclosing.parent)
            {
                if (enclosing.type.findField(name, true) != null)
                {
                    return enclosing.accessPrefix + Names.memberName(name);
                }
            }
        }

        if (!allowUnresolvedReferences)
        {
            throw new UnresolvedReferenceException(scope.type.name(), field.name(), name);
        }

        log(RESOLUTION, "Unresolved reference '%s' in %s.%s (%s%s) rendered as a bare name",
            name, scope.type.name(), field.name(), scope.namePrefix, memberName(field));
        return Names.memberName(name);
    }

    /**
     * A compound being streamed: its member access prefix and the argument its enclosing field passes.
     */
    private static final class Scope
    {
        private final CompoundType type;
        private final String namePrefix;
        private final String accessPrefix;
        private final String argument;
        private final Scope parent;

        private Scope(
            final CompoundType type,
            final String namePrefix,
            final String accessPrefix,
            final String argument,
            final Scope parent)
        {
            this.type = type;
            this.namePrefix = namePrefix;
            this.accessPrefix = accessPrefix;
            this.argument = argument;
            this.parent = parent;
        }
    }

    /**
     * The currently open version and condition guards. A condition guard is always nested in the version guard.
     */
    private static final class Guards
    {
        private static final List<Object> NO_VERSION = Arrays.asList(null, null, null, null, "");

        private final CodeWriter writer;
        private List<Object> version = NO_VERSION;
        private String condition = "";
        private boolean versionOpen;
        private boolean conditionOpen;

        private Guards(final CodeWriter writer)
        {
            this.writer = writer;
        }

        private void enter(final Field field, final String vercond, final String condition)
        {
            final List<Object> version = Arrays.asList(
                field.ver1(), field.ver2(), field.userVersion(), field.userVersion2(), vercond);
            if (!version.equals(this.version))
            {
                closeCondition();
                closeVersion();

                final String expression = versionExpression(field, vercond);
                if (!expression.isEmpty())
                {
                    writer.code(isBracketed(expression) ? "if " + expression + " {" : "if ( " + expression + " ) {");
                    versionOpen = true;
                }
                openCondition(condition);
                this.version = version;
            }
            else
            {
                enterCondition(condition);
            }
        }

        private void enterCondition(final String condition)
        {
            if (!condition.equals(this.condition))
            {
                closeCondition();
                openCondition(condition);
            }
        }

        private void openCondition(final String condition)
        {
            if (!condition.isEmpty())
            {
                writer.code("if ( " + condition + " ) {");
                conditionOpen = true;
            }
            this.condition = condition;
        }

        private void closeCondition()
        {
            if (conditionOpen)
            {
                writer.code("};");
                conditionOpen = false;
            }
            condition = "";
        }

        private void closeVersion()
        {
            if (versionOpen)
            {
                writer.code("};");
                versionOpen = false;
            }
            version = NO_VERSION;
        }

        private void close()
        {
            closeCondition();
            closeVersion();
        }

        private static String versionExpression(final Field field, final String vercond)
        {
            final List<String> terms = new ArrayList<>();
            if (field.ver1() != null)
            {
                terms.add("( info.version >= " + Version.toHex(field.ver1()) + " )");
            }
            if (field.ver2() != null)
            {
                terms.add("( info.version <= " + Version.toHex(field.ver2()) + " )");
            }
            if (field.userVersion() != null)
            {
                terms.add("( info.userVersion == " + field.userVersion() + " )");
            }
            if (field.userVersion2() != null)
            {
                terms.add("( info.userVersion2 == " + field.userVersion2() + " )");
            }
            if (!vercond.isEmpty())
            {
                terms.add("( " + vercond + " )");
            }

            return String.join(" && ", terms);
        }
    }
}
