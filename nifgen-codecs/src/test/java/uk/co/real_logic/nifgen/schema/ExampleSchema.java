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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class ExampleSchema
{
    public static final String EXAMPLE_FILE = "example_schema.xml";

    private static final String DOCUMENT_START =
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n" +
        "<niftoolsxml version=\"0.7.0.0\">\n" +
        "    <basic name=\"bool\" count=\"1\">A boolean.</basic>\n" +
        "    <basic name=\"byte\" count=\"1\">An unsigned 8-bit integer.</basic>\n" +
        "    <basic name=\"ushort\" count=\"1\">An unsigned 16-bit integer.</basic>\n" +
        "    <basic name=\"uint\" count=\"1\">An unsigned 32-bit integer.</basic>\n" +
        "    <basic name=\"float\" count=\"1\">A 32-bit float.</basic>\n" +
        "    <basic name=\"string\" count=\"0\">A string.</basic>\n" +
        "    <basic name=\"Ref\" count=\"1\" istemplate=\"1\">An owning reference.</basic>\n" +
        "    <basic name=\"Ptr\" count=\"1\" istemplate=\"1\">A non-owning pointer.</basic>\n" +
        "    <basic name=\"Vector3\" count=\"0\">Three floats.</basic>\n";

    private static final String DOCUMENT_END = "</niftoolsxml>\n";

    private ExampleSchema()
    {
    }

    public static InputStream exampleStream()
    {
        return ExampleSchema.class.getResourceAsStream(EXAMPLE_FILE);
    }

    /**
     * @param excludedFields fields to leave out, as <code>Type:Field</code>.
     * @return the example schema.
     */
    public static SchemaContext exampleSchema(final String... excludedFields) throws IOException
    {
        try (InputStream in = exampleStream())
        {
            return new SchemaParser(Arrays.asList(excludedFields)).parse(in);
        }
    }

    /**
     * Wrap type declarations into a schema document that already declares the common basic types.
     *
     * @param declarations enums, compounds and blocks.
     * @return the document text.
     */
    public static String document(final String declarations)
    {
        return DOCUMENT_START + declarations + DOCUMENT_END;
    }

    public static InputStream documentStream(final String declarations)
    {
        return new ByteArrayInputStream(document(declarations).getBytes(UTF_8));
    }

    public static SchemaContext parse(final String declarations)
    {
        return new SchemaParser().parse(documentStream(declarations));
    }
}
