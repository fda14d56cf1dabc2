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
import uk.co.real_logic.nifgen.schema.ir.Field;

public final class GenerationUtil
{
    public static final String NAMESPACE = "Niflib";

    public static final String COPYRIGHT_NOTICE =
        "/* Copyright (c) 2017, NIF File Format Library and Tools\n" +
        "All rights reserved.  Please see niflib.h for license. */";

    public static final String PARTIALLY_GENERATED_NOTICE = COPYRIGHT_NOTICE + "\n\n" +
        "//-----------------------------------NOTICE----------------------------------//\n" +
        "// Some of this file is automatically filled in by a code generator.  Only   //\n" +
        "// add custom code in the designated areas or it will be overwritten during  //\n" +
        "// the next update.                                                          //\n" +
        "//-----------------------------------NOTICE----------------------------------//";

    public static final String FULLY_GENERATED_NOTICE = COPYRIGHT_NOTICE + "\n\n" +
        "//---THIS FILE WAS AUTOMATICALLY GENERATED.  DO NOT EDIT---//\n\n" +
        "// To change this file, alter the schema and run nifgen again.";

    static final String CLASS_DECLARATION =
        "/*! Constructor */\n" +
        "NIFLIB_API %1$s();\n" +
        "\n" +
        "/*! Destructor */\n" +
        "NIFLIB_API virtual ~%1$s();\n" +
        "\n" +
        "/*!\n" +
        " * A constant value which uniquly identifies objects of this type.\n" +
        " */\n" +
        "NIFLIB_API static const Type TYPE;\n" +
        "\n" +
        "/*!\n" +
        " * A factory function used during file reading to create an instance of this type of object.\n" +
        " * \\return A pointer to a newly allocated instance of this type of object.\n" +
        " */\n" +
        "NIFLIB_API static NiObject * Create();\n" +
        "\n" +
        "/*!\n" +
        " * Summarizes the information contained in this object in English.\n" +
        " * \\param[in] verbose Determines whether or not detailed information about large areas of data will " +
        "be printed out.\n" +
        " * \\return A string containing a summary of the information within the object in English.  This is the " +
        "function that Niflyze calls to generate its analysis, so the output is the same.\n" +
        " */\n" +
        "NIFLIB_API virtual string asString( bool verbose = false ) const;\n" +
        "\n" +
        "/*!\n" +
        " * Used to determine the type of a particular instance of this object.\n" +
        " * \\return The type constant for the actual type of the object.\n" +
        " */\n" +
        "NIFLIB_API virtual const Type & GetType() const;";

    static final String CLASS_INTERNALS =
        "/*! NIFLIB_HIDDEN function.  For internal use only. */\n" +
        "NIFLIB_HIDDEN virtual void Read( istream& in, list<unsigned int> & link_stack, " +
        "const NifInfo & info );\n" +
        "/*! NIFLIB_HIDDEN function.  For internal use only. */\n" +
        "NIFLIB_HIDDEN virtual void Write( ostream& out, const map<NiObjectRef,unsigned int> & link_map, " +
        "list<NiObject *> & missing_link_stack, const NifInfo & info ) const;\n" +
        "/*! NIFLIB_HIDDEN function.  For internal use only. */\n" +
        "NIFLIB_HIDDEN virtual void FixLinks( const map<unsigned int,NiObjectRef> & objects, " +
        "list<unsigned int> & link_stack, list<NiObjectRef> & missing_link_stack, const NifInfo & info );\n" +
        "/*! NIFLIB_HIDDEN function.  For internal use only. */\n" +
        "NIFLIB_HIDDEN virtual list<NiObjectRef> GetRefs() const;\n" +
        "/*! NIFLIB_HIDDEN function.  For internal use only. */\n" +
        "NIFLIB_HIDDEN virtual list<NiObject *> GetPtrs() const;";

    static final String COMPOUND_DECLARATION =
        "/*! Default Constructor */\n" +
        "NIFLIB_API %1$s();\n" +
        "/*! Default Destructor */\n" +
        "NIFLIB_API ~%1$s();\n" +
        "/*! Copy Constructor */\n" +
        "NIFLIB_API %1$s( const %1$s & src );\n" +
        "/*! Copy Operator */\n" +
        "NIFLIB_API %1$s & operator=( const %1$s & src );";

    static final String READ_SIGNATURE =
        "void %s::Read( istream& in, list<unsigned int> & link_stack, const NifInfo & info ) {";
    static final String WRITE_SIGNATURE =
        "void %s::Write( ostream& out, const map<NiObjectRef,unsigned int> & link_map, " +
        "list<NiObject *> & missing_link_stack, const NifInfo & info ) const {";
    static final String FIX_LINKS_SIGNATURE =
        "void %s::FixLinks( const map<unsigned int,NiObjectRef> & objects, list<unsigned int> & link_stack, " +
        "list<NiObjectRef> & missing_link_stack, const NifInfo & info ) {";

    static final String INCLUDE_DIR = "include/";
    static final String SOURCE_DIR = "src/";
    static final String GEN_DIR = "gen/";
    static final String OBJ_DIR = "obj/";

    static final String SOURCE_GEN_INCLUDE_PREFIX = "../../include/gen/";
    static final String SOURCE_OBJ_INCLUDE_PREFIX = "../../include/obj/";

    private GenerationUtil()
    {
    }

    /**
     * @param field a field.
     * @return the member variable holding the field's value, suffix included.
     */
    public static String memberName(final Field field)
    {
        return Names.memberName(field.uniqueName());
    }

    static String quoted(final String file)
    {
        return "\"" + file + "\"";
    }

    static String spaces(final int count)
    {
        final StringBuilder spaces = new StringBuilder(Math.max(count, 0));
        for (int i = 0; i < count; i++)
        {
            spaces.append(' ');
        }
        return spaces.toString();
    }

    /**
     * Whether a bracketed expression spans the whole text, so it needs no further brackets.
     *
     * @param text the text.
     * @return true if the text opens with a bracket that closes at its last character.
     */
    static boolean isBracketed(final String text)
    {
        if (text.isEmpty() || text.charAt(0) != '(')
        {
            return false;
        }

        int depth = 0;
        for (int i = 0; i < text.length(); i++)
        {
            final char ch = text.charAt(i);
            if (ch == '(')
            {
                depth++;
            }
            else if (ch == ')')
            {
                depth--;
                if (depth == 0)
                {
                    return i == text.length() - 1;
                }
            }
        }

        return false;
    }
}
