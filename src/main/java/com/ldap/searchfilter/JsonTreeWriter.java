package com.ldap.searchfilter;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ldap.searchfilter.model.Branch;
import com.ldap.searchfilter.model.BranchContext;
import com.ldap.searchfilter.model.BranchElement;
import com.ldap.searchfilter.model.Filter;
import com.ldap.searchfilter.model.Token;
import com.ldap.searchfilter.model.TokenType;

/**
 * Renders tokens, filters and branch trees as JSON for the non-string output formats.
 */
public class JsonTreeWriter {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static String toJsonString(Object representation) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(representation));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render SearchFilter as JSON", e);
        }
    }

    /**
     * @param representation a Branch, Filter, Token, String or a List of BranchElements
     */
    public static JsonNode toJson(Object representation) {
        if (representation instanceof Branch) {
            return branchJson((Branch) representation);
        }
        if (representation instanceof Filter) {
            return filterJson((Filter) representation);
        }
        if (representation instanceof Token) {
            return tokenJson((Token) representation);
        }
        if (representation instanceof List) {
            ArrayNode array = mapper.createArrayNode();
            for (Object item : (List<?>) representation) {
                array.add(toJson(item));
            }
            return array;
        }
        if (representation instanceof String) {
            return mapper.getNodeFactory().textNode((String) representation);
        }
        throw new IllegalArgumentException("Unsupported representation: "
                + (representation == null ? "null" : representation.getClass().getName()));
    }

    static ObjectNode tokenJson(Token token) {
        ObjectNode node = mapper.createObjectNode();
        node.put("guid", token.getGuid().toString());
        node.put("type", token.getType().getName());
        if (token.getSubType() != null) {
            node.put("subType", token.getSubType().name());
        }
        node.put("content", token.getContent());
        if (token.isType(TokenType.VALUE)) {
            node.put("decodedContent", token.getDecodedContent());
        }
        node.put("start", token.getStart());
        node.put("length", token.getLength());
        node.put("depth", token.getDepth());
        if (token.getTypeBefore() != null) {
            node.put("typeBefore", token.getTypeBefore().getName());
        }
        if (token.getTypeAfter() != null) {
            node.put("typeAfter", token.getTypeAfter().getName());
        }
        node.put("modified", token.isModified());
        if (!token.getTokenList().isEmpty()) {
            ArrayNode nested = node.putArray("tokenList");
            for (Token child : token.getTokenList()) {
                nested.add(tokenJson(child));
            }
        }
        return node;
    }

    static ObjectNode filterJson(Filter filter) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "Filter");
        node.put("content", filter.getContent());
        node.put("depth", filter.getDepth());
        ArrayNode tokens = node.putArray("tokens");
        for (Token token : filter.getTokens()) {
            tokens.add(tokenJson(token));
        }
        return node;
    }

    private static ObjectNode branchJson(Branch root) {
        ObjectNode rootNode = branchHeader(root);
        Deque<Branch> branches = new ArrayDeque<>();
        Deque<ObjectNode> nodes = new ArrayDeque<>();
        branches.push(root);
        nodes.push(rootNode);
        while (!branches.isEmpty()) {
            Branch branch = branches.pop();
            ArrayNode elements = nodes.pop().putArray("elements");
            for (BranchElement element : branch.getElements()) {
                if (element instanceof Branch) {
                    ObjectNode child = branchHeader((Branch) element);
                    elements.add(child);
                    branches.push((Branch) element);
                    nodes.push(child);
                } else if (element instanceof Filter) {
                    elements.add(filterJson((Filter) element));
                } else {
                    elements.add(tokenJson((Token) element));
                }
            }
        }
        return rootNode;
    }

    private static ObjectNode branchHeader(Branch branch) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", branch.getType().getName());
        node.put("depth", branch.getDepth());
        node.put("content", branch.getContent());
        node.put("booleanOperator", branch.getBooleanOperator());

        BranchContext context = branch.getContext();
        ObjectNode contextNode = node.putObject("context");
        contextNode.put("filterListBooleanOperator", context.getFilterListBooleanOperator());
        contextNode.put("filterBooleanOperator", context.getFilterBooleanOperator());
        contextNode.put("stale", context.isStale());
        contextNode.put("locallyPatched", context.isLocallyPatched());

        ObjectNode counters = node.putObject("counters");
        counters.put("depthMax", branch.getDepthMax());
        counters.put("booleanOperatorCountMax", branch.getBooleanOperatorCountMax());
        counters.put("booleanOperatorLogicalCountMax", branch.getBooleanOperatorLogicalCountMax());
        return node;
    }
}
