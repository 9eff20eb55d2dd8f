package com.ldap.searchfilter.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterSerializer;

/**
 * Runs one transform pass on a reparsed copy of the input and reparses the result.
 */
public abstract class AbstractSearchFilterTransform implements SearchFilterTransform {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    @Override
    public Branch transform(Branch tree, TransformOptions options) {
        // Keep incoming flags so modifications of earlier passes stay visible when tracking
        Branch working = SearchFilterSerializer.reparse(tree, true);
        int changes = 0;
        if (options.getRandomNodePercent() > 0) {
            changes = apply(working, options);
        }
        Branch result = SearchFilterSerializer.reparse(working, options.isTrackModification());
        if (changes > 0) {
            logger.debug("{}: {} change(s), '{}' -> '{}'", getName(), changes, tree.getContent(), result.getContent());
        }
        return result;
    }

    /**
     * Mutates the working tree in place through the mutation primitives.
     *
     * @return number of mutations made
     */
    protected abstract int apply(Branch tree, TransformOptions options);
}
