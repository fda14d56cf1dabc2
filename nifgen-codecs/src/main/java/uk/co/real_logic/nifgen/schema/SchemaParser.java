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
package uk.co.real_logic.nifgen.schema;

import org.w3c.dom.*;
import org.xml.sax.SAXException;
import uk.co.real_logic.nifgen.schema.expression.Expression;
import uk.co.real_logic.nifgen.schema.expression.ExpressionParser;
import uk.co.real_logic.nifgen.schema.expression.ExpressionSyntaxException;
import uk.co.real_logic.nifgen.schema.ir.*;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathExpression;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

import static javax.xml.xpath.XPathConstants.NODESET;
import static uk.co.real_logic.nifgen.DebugLogger.log;
import static uk.co.real_logic.nifgen.LogTag.SCHEMA;

/**
 * Parses <code>niftoolsxml</code> schema documents into a {@link SchemaContext}.
 * <p>
 * Versions, basics, enums, bit flags, compounds and blocks are loaded in that order, each in document order. Field
 * types, templates and expressions are linked in a second pass once every name is known, then the
 * {@link FieldResolver} derives the per field facts used by code generation.
 */
public final class SchemaParser
{
    private static final String ROOT_ELEMENT = "niftoolsxml";
    private static final String VERSION_EXPR = "/niftoolsxml/version";
    private static final String BASIC_EXPR = "/niftoolsxml/basic";
    private static final String ENUM_EXPR = "/niftoolsxml/enum";
    private static final String BITFLAGS_EXPR = "/niftoolsxml/bitflags";
    private static final String COMPOUND_EXPR = "/niftoolsxml/compound";
    private static final String BLOCK_EXPR = "/niftoolsxml/niobject";

    private final DocumentBuilder documentBuilder;
    private final XPathExpression findVersion;
    private final XPathExpression findBasic;
    private final XPathExpression findEnum;
    private final XPathExpression findBitflags;
    private final XPathExpression findCompound;
    private final XPathExpression findBlock;

    private final Set<String> excludedFields;

    public SchemaParser()
    {
        this(Collections.emptySet());
    }

    /**
     * @param excludedFields fields left out while loading, as <code>Type:Field</code>. Used for recursively
     *                       defined compounds that the runtime can't represent.
     */
    public SchemaParser(final Collection<String> excludedFields)
    {
        this.excludedFields = new HashSet<>(excludedFields);
        try
        {
            documentBuilder = DocumentBuilderFactory.newInstance().newDocumentBuilder();

            final XPath xPath = XPathFactory.newInstance().newXPath();
            findVersion = xPath.compile(VERSION_EXPR);
            findBasic = xPath.compile(BASIC_EXPR);
            findEnum = xPath.compile(ENUM_EXPR);
            findBitflags = xPath.compile(BITFLAGS_EXPR);
            findCompound = xPath.compile(COMPOUND_EXPR);
            findBlock = xPath.compile(BLOCK_EXPR);
        }
        catch (final ParserConfigurationException | XPathExpressionException ex)
        {
            throw new RuntimeException(ex);
        }
    }

    public SchemaContext parse(final Path path)
    {
        try (InputStream in = Files.newInputStream(path))
        {
            return parse(in);
        }
        catch (final NoSuchFileException ex)
        {
            throw new SchemaLoadException("Schema document not found: " + path, ex);
        }
        catch (final IOException ex)
        {
            throw new SchemaLoadException("Unable to read schema document: " + path, ex);
        }
    }

    public SchemaContext parse(final InputStream in)
    {
        if (in == null)
        {
            throw new SchemaLoadException("Missing schema document");
        }

        final Document document;
        try
        {
            document = documentBuilder.parse(in);
        }
        catch (final SAXException | IOException ex)
        {
            throw new SchemaLoadException("Unable to parse schema document: " + ex.getMessage(), ex);
        }

        final Element root = document.getDocumentElement();
        if (root == null || !ROOT_ELEMENT.equals(root.getNodeName()))
        {
            throw new SchemaLoadException(
                "Expected root element " + ROOT_ELEMENT + " but was " + (root == null ? null : root.getNodeName()));
        }

        try
        {
            final SchemaContext context = new SchemaContext();
            parseVersions(document, context);
            parseBasics(document, context);
            parseEnums(document, context, findEnum, false);
            parseEnums(document, context, findBitflags, true);
            parseCompounds(document, context);
            parseBlocks(document, context);
            addTemplateParameter(context);

            linkFields(context);
            new FieldResolver(context).resolve();

            log(SCHEMA, "Loaded %s", context);
            return context;
        }
        catch (final XPathExpressionException ex)
        {
            throw new SchemaLoadException("Unable to query schema document", ex);
        }
    }

    private void parseVersions(final Document document, final SchemaContext context)
        throws XPathExpressionException
    {
        extractNodes(document, findVersion,
            (node) ->
            {
                final String number = getValue(node.getAttributes(), "num");
                try
                {
                    context.addVersion(new Version(number, description(node)));
                }
                catch (final IllegalArgumentException ex)
                {
                    throw new SchemaLoadException("Invalid version: " + number, ex);
                }
            });
    }

    private void parseBasics(final Document document, final SchemaContext context)
        throws XPathExpressionException
    {
        extractNodes(document, findBasic,
            (node) ->
            {
                final NamedNodeMap attributes = node.getAttributes();
                final String name = name(attributes);
                context.add(new BasicType(
                    name,
                    typeDescription(node, name),
                    NativeTypes.nativeName(name),
                    NativeTypes.family(name),
                    getOptionalValue(attributes, "count"),
                    isSet(attributes, "istemplate")));
            });
    }

    private void parseEnums(
        final Document document,
        final SchemaContext context,
        final XPathExpression expression,
        final boolean isFlags)
        throws XPathExpressionException
    {
        extractNodes(document, expression,
            (node) ->
            {
                final NamedNodeMap attributes = node.getAttributes();
                final String name = name(attributes);
                final String storageName = getValue(attributes, "storage");
                final TypeEntity storage = context.type(storageName);
                if (!(storage instanceof BasicType))
                {
                    throw new SchemaLoadException(String.format(
                        "Storage type %1$s of enum %2$s is not a declared basic type", storageName, name));
                }

                final String prefix = getOptionalValue(attributes, "prefix");
                final String description = description(node);
                final EnumType enumType = isFlags ?
                    new FlagType(name, description, (BasicType)storage, prefix) :
                    new EnumType(name, description, (BasicType)storage, prefix);

                forEachChild(node, "option",
                    (optionNode) -> enumType.addOption(parseOption(enumType, optionNode, isFlags)));

                context.add(enumType);
            });
    }

    private Option parseOption(final EnumType enumType, final Node node, final boolean isFlags)
    {
        final NamedNodeMap attributes = node.getAttributes();
        final String optionName = enumType.prefixed(name(attributes));
        final String value = getValue(attributes, "value");
        final String description = description(node);
        try
        {
            return isFlags ?
                Option.flagOption(optionName, Integer.decode(value), description) :
                Option.enumOption(optionName, Long.decode(value), description);
        }
        catch (final NumberFormatException ex)
        {
            throw new SchemaLoadException(String.format(
                "Invalid value %1$s for option %2$s of %3$s", value, optionName, enumType.name()), ex);
        }
    }

    private void parseCompounds(final Document document, final SchemaContext context)
        throws XPathExpressionException
    {
        extractNodes(document, findCompound,
            (node) ->
            {
                final NamedNodeMap attributes = node.getAttributes();
                final String name = name(attributes);
                final CompoundType compound = new CompoundType(
                    name,
                    typeDescription(node, name),
                    NativeTypes.nativeName(name),
                    isSet(attributes, "istemplate"));

                parseFields(node, compound);
                context.add(compound);
            });
    }

    private void parseBlocks(final Document document, final SchemaContext context)
        throws XPathExpressionException
    {
        extractNodes(document, findBlock,
            (node) ->
            {
                final NamedNodeMap attributes = node.getAttributes();
                final String name = name(attributes);
                final String inherit = getOptionalValue(attributes, "inherit");
                BlockType parent = null;
                if (inherit != null && !inherit.isEmpty())
                {
                    parent = context.block(inherit);
                    if (parent == null)
                    {
                        throw new SchemaLoadException(String.format(
                            "Block %1$s inherits from %2$s which is not a previously declared block",
                            name,
                            inherit));
                    }
                }

                final BlockType block = new BlockType(
                    name,
                    typeDescription(node, name),
                    parent,
                    isSet(attributes, "abstract"),
                    hasChild(node, "interface"));

                parseFields(node, block);
                context.add(block);
            });
    }

    private void addTemplateParameter(final SchemaContext context)
    {
        if (context.type(BasicType.TEMPLATE) == null)
        {
            context.add(new BasicType(
                BasicType.TEMPLATE,
                "Template parameter of template compounds.",
                NativeTypes.nativeName(BasicType.TEMPLATE),
                NativeTypes.family(BasicType.TEMPLATE),
                null,
                false));
        }
    }

    private void parseFields(final Node node, final CompoundType compound)
    {
        forEachChild(node, "add",
            (fieldNode) ->
            {
                final NamedNodeMap attributes = fieldNode.getAttributes();
                final String name = name(attributes);
                if (excludedFields.contains(compound.name() + ":" + name))
                {
                    log(SCHEMA, "Excluded field %s.%s", compound.name(), name);
                    return;
                }

                final Field field = new Field(name, getValue(attributes, "type"))
                    .suffix(getOptionalValue(attributes, "suffix"))
                    .templateName(getOptionalValue(attributes, "template"))
                    .argument(getOptionalValue(attributes, "arg"))
                    .arr1Text(getOptionalValue(attributes, "arr1"))
                    .arr2Text(getOptionalValue(attributes, "arr2"))
                    .condText(getOptionalValue(attributes, "cond"))
                    .vercondText(getOptionalValue(attributes, "vercond"))
                    .function(getOptionalValue(attributes, "function"))
                    .declaredDefault(getOptionalValue(attributes, "default"))
                    .isPublic(isSet(attributes, "public"))
                    .isAbstract(isSet(attributes, "abstract"))
                    .isCalculated(isSet(attributes, "calculated"));

                try
                {
                    field
                        .ver1(getOptionalValue(attributes, "ver1"))
                        .ver2(getOptionalValue(attributes, "ver2"))
                        .userVersion(userVersion(attributes, "userver"))
                        .userVersion2(userVersion(attributes, "userver2"));
                }
                catch (final IllegalArgumentException ex)
                {
                    throw new SchemaLoadException(String.format(
                        "Invalid version attribute on %1$s.%2$s: %3$s", compound.name(), name, ex.getMessage()), ex);
                }

                final String description = description(fieldNode);
                field.description(description.isEmpty() && name.toLowerCase().startsWith("unk") ?
                    "Unknown." : description);

                compound.addField(field);
            });
    }

    private void linkFields(final SchemaContext context)
    {
        final ExpressionParser expressionParser = new ExpressionParser(context::isBlock);
        for (final CompoundType compound : context.structures())
        {
            for (final Field field : compound.fields())
            {
                final TypeEntity type = context.type(field.typeName());
                if (type == null)
                {
                    throw new SchemaLoadException(String.format(
                        "Unknown type %1$s of field %2$s.%3$s", field.typeName(), compound.name(), field.name()));
                }
                if (type instanceof BlockType)
                {
                    throw new SchemaLoadException(String.format(
                        "Field %2$s.%3$s has block type %1$s, blocks are only referenced through Ref or Ptr",
                        field.typeName(),
                        compound.name(),
                        field.name()));
                }
                field.type(type);

                if (field.templateName() != null)
                {
                    final TypeEntity template = context.type(field.templateName());
                    if (template == null)
                    {
                        throw new SchemaLoadException(String.format(
                            "Unknown template %1$s of field %2$s.%3$s",
                            field.templateName(),
                            compound.name(),
                            field.name()));
                    }
                    field.template(template);
                }

                field
                    .arr1(parseExpression(expressionParser, compound, field, field.arr1Text()))
                    .arr2(parseExpression(expressionParser, compound, field, field.arr2Text()))
                    .cond(parseExpression(expressionParser, compound, field, field.condText()))
                    .vercond(parseExpression(expressionParser, compound, field, field.vercondText()));
            }
        }
    }

    private static Expression parseExpression(
        final ExpressionParser expressionParser,
        final CompoundType compound,
        final Field field,
        final String text)
    {
        try
        {
            return expressionParser.parse(text);
        }
        catch (final ExpressionSyntaxException ex)
        {
            throw new SchemaLoadException(String.format(
                "Invalid expression in %1$s.%2$s: %3$s", compound.name(), field.name(), ex.getMessage()), ex);
        }
    }

    private static Long userVersion(final NamedNodeMap attributes, final String attributeName)
    {
        final String value = getOptionalValue(attributes, attributeName);
        return value == null || value.isEmpty() ? null : Long.decode(value);
    }

    private static String typeDescription(final Node node, final String name)
    {
        final String description = description(node);
        return description.isEmpty() && name.toLowerCase().startsWith("unk") ? "Unknown." : description;
    }

    /**
     * The text directly inside an element, ignoring the text of child elements.
     */
    private static String description(final Node node)
    {
        final StringBuilder builder = new StringBuilder();
        final NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++)
        {
            final Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE)
            {
                builder.append(child.getNodeValue());
            }
        }

        return builder.toString().trim();
    }

    private static String name(final NamedNodeMap attributes)
    {
        final String name = getValue(attributes, "name");
        if (name.trim().isEmpty())
        {
            throw new SchemaLoadException("Empty name attribute");
        }
        return name;
    }

    private static boolean isSet(final NamedNodeMap attributes, final String attributeName)
    {
        return "1".equals(getOptionalValue(attributes, attributeName));
    }

    private static String getValue(final NamedNodeMap attributes, final String attributeName)
    {
        final String value = getOptionalValue(attributes, attributeName);
        if (value == null)
        {
            throw new SchemaLoadException("Missing attribute " + attributeName + " in " + toString(attributes));
        }
        return value;
    }

    private static String getOptionalValue(final NamedNodeMap attributes, final String attributeName)
    {
        Objects.requireNonNull(attributes, "Null attributes for " + attributeName);
        final Node attributeNode = attributes.getNamedItem(attributeName);
        return attributeNode == null ? null : attributeNode.getNodeValue();
    }

    private static String toString(final NamedNodeMap attributes)
    {
        final StringBuilder builder = new StringBuilder("{");
        for (int i = 0; i < attributes.getLength(); i++)
        {
            final Node node = attributes.item(i);
            if (i > 0)
            {
                builder.append(',');
            }
            builder.append(node.getNodeName()).append('=').append(node.getNodeValue());
        }
        return builder.append('}').toString();
    }

    private void extractNodes(
        final Document document, final XPathExpression expression, final Consumer<Node> handler)
        throws XPathExpressionException
    {
        forEach((NodeList)expression.evaluate(document, NODESET), handler);
    }

    private static void forEachChild(final Node node, final String elementName, final Consumer<Node> handler)
    {
        forEach(node.getChildNodes(),
            (child) ->
            {
                if (elementName.equals(child.getNodeName()))
                {
                    handler.accept(child);
                }
            });
    }

    private static boolean hasChild(final Node node, final String elementName)
    {
        final NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++)
        {
            if (elementName.equals(children.item(i).getNodeName()))
            {
                return true;
            }
        }
        return false;
    }

    private static void forEach(final NodeList nodes, final Consumer<Node> handler)
    {
        for (int i = 0; i < nodes.getLength(); i++)
        {
            final Node node = nodes.item(i);
            if (node instanceof Element)
            {
                handler.accept(node);
            }
        }
    }
}
