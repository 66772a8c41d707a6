package org.epubmeta.dom;

import org.apache.commons.lang3.StringUtils;

/**
 * A {@code prefix:local} name as written in EPUB queries and mutators.
 *
 * @param prefix    namespace prefix, empty if none was given
 * @param localName local part of the name
 */
public record QualifiedName(String prefix, String localName) {

    public static QualifiedName parse(String name) {
        int colon = name.indexOf(':');
        if (colon < 0) {
            return new QualifiedName("", name);
        }
        return new QualifiedName(name.substring(0, colon), name.substring(colon + 1));
    }

    public boolean hasPrefix() {
        return StringUtils.isNotEmpty(prefix);
    }

    @Override
    public String toString() {
        return hasPrefix() ? prefix + ":" + localName : localName;
    }
}
