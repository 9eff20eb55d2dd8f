package com.ldap.searchfilter.transform;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterConverter;

/**
 * A semantics-preserving deobfuscation pass.
 *
 * Implementations never modify the tree they are given; they work on a reparsed copy and return a
 * freshly reparsed result so offsets, depths and contexts are authoritative again.
 */
public interface SearchFilterTransform {

    String getName();

    Branch transform(Branch tree, TransformOptions options);

    /**
     * Accepts any supported representation and returns the one requested by
     * {@link TransformOptions#getTarget()}.
     */
    default Object apply(Object input, TransformOptions options) {
        Branch result = transform(SearchFilterConverter.toBranch(input), options);
        return SearchFilterConverter.convert(result, options.getTarget());
    }
}
