package com.ldap.searchfilter.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.parser.SearchFilterSerializer;

public class ProtocolLimitCheckerTest {

    @Test
    public void testWithinDefaults() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(&(b=2)(c=*)))");

        assertTrue(new ProtocolLimitChecker().check(tree).isEmpty());
    }

    @Test
    public void testExceeded() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(&(b=2)(c=*)))");

        List<LimitWarning> warnings = new ProtocolLimitChecker(2, 1, 1).check(tree);

        assertEquals(3, warnings.size());
        assertEquals(LimitWarning.Limit.DEPTH, warnings.get(0).getLimit());
        assertEquals(3, warnings.get(0).getActual());
        assertEquals("BooleanOperator logical count 3 exceeds maximum 1", warnings.get(2).toString());
    }

    @Test
    public void testCheckedFromAnyBranch() {
        Branch tree = SearchFilterSerializer.parse("(&(a=1)(&(b=2)(c=*)))");
        Branch nested = tree.getNestedBranches().get(0).getNestedBranches().get(0);

        assertEquals(3, new ProtocolLimitChecker(2, 1, 1).check(nested).size());
    }
}
