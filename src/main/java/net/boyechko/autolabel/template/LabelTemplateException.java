/*
 * AutoLabel - Counter-based labelling for document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolabel.template;

/** Thrown when a label template string is malformed or names an unknown counter style. */
public class LabelTemplateException extends Exception {
    private final String template;
    private final int offset;
    private final String offending;

    public LabelTemplateException(String message, String template, int offset) {
        super(message + " in template '" + template + "' at offset " + offset);
        this.template = template;
        this.offset = offset;
        this.offending = template.substring(Math.min(offset, template.length()));
    }

    /** The whole template string being parsed. */
    public String template() {
        return template;
    }

    /** Character offset at which parsing failed. */
    public int offset() {
        return offset;
    }

    /** The remainder of the template from the point of failure. */
    public String offending() {
        return offending;
    }
}
