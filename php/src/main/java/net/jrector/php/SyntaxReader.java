package net.jrector.php;

import net.jrector.api.DocComment;
import net.jrector.api.Node;
import net.jrector.api.NodeKind;
import net.jrector.api.ParseException;
import net.jrector.api.ResolvedType;
import net.jrector.api.SourceSpan;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive descent over the token list of one file.
 */
final class SyntaxReader {
    private static final Set<String> CLASS_MODIFIERS = Set.of("abstract", "final", "readonly");
    private static final Set<String> MEMBER_MODIFIERS = Set.of("public", "protected", "private", "static", "abstract", "final", "readonly", "var");
    private static final Set<String> PROMOTION_MODIFIERS = Set.of("public", "protected", "private", "readonly");
    private static final Set<String> CASTS = Set.of("int", "integer", "bool", "boolean", "float", "double", "real", "string", "array", "object", "unset", "binary");
    private static final Set<String> PREFIX_KEYWORDS = Set.of("include", "include_once", "require", "require_once", "print", "clone");
    private static final Set<NodeKind> ASSIGNABLE = Set.of(NodeKind.VARIABLE, NodeKind.ARRAY_DIM_FETCH, NodeKind.PROPERTY_FETCH,
            NodeKind.STATIC_PROPERTY_FETCH, NodeKind.ARRAY);

    private final String source;
    private final List<Token> tokens;
    private int index;
    private int lastEnd;

    SyntaxReader(String source, List<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    Node readFile() throws ParseException {
        while (tokens.get(index).type() != TokenType.OPEN_TAG) {
            index++;
        }
        int listStart = tokens.get(index).end();
        lastEnd = listStart;
        index = nextSignificant(index + 1);

        var statements = new ArrayList<Node>();
        while (peek().type() != TokenType.EOF) {
            statements.add(readTopStatement());
        }

        var items = new ArrayList<Node>();
        if (statements.stream().anyMatch(statement -> statement.is(NodeKind.NAMESPACE))) {
            items.addAll(statements);
        } else {
            int first = 0;
            while (first < statements.size() && statements.get(first).is(NodeKind.DECLARE)) {
                items.add(statements.get(first++));
            }
            if (first < statements.size()) {
                var body = statements.subList(first, statements.size());
                var fileWithoutNamespace = new Node(NodeKind.FILE_WITHOUT_NAMESPACE, null, body);
                int start = body.get(0).span().start();
                fileWithoutNamespace.setSpan(new SourceSpan(start, body.get(body.size() - 1).span().end()));
                fileWithoutNamespace.putAttribute(PhpParser.LIST_START, start);
                items.add(fileWithoutNamespace);
            }
        }

        var file = new Node(NodeKind.FILE, null, items);
        file.setSpan(new SourceSpan(0, source.length()));
        file.putAttribute(PhpParser.LIST_START, listStart);
        return file;
    }

    private Node readTopStatement() throws ParseException {
        if (peek().isKeyword("namespace") && (peek(1).type() == TokenType.NAME || peek(1).isOperator("{"))) {
            return readNamespace();
        }
        return readStatement();
    }

    private Node readNamespace() throws ParseException {
        int start = next().start();
        Node name = null;
        if (peek().type() == TokenType.NAME) {
            name = readName();
        }
        var statements = new ArrayList<Node>();
        Node namespace;
        if (accept("{")) {
            int listStart = lastEnd;
            while (!peek().isOperator("}")) {
                statements.add(readStatement());
            }
            expect("}");
            namespace = namespaceNode(name, statements, "braced", listStart);
        } else {
            expect(";");
            int listStart = lastEnd;
            while (peek().type() != TokenType.EOF && !(peek().isKeyword("namespace") && (peek(1).type() == TokenType.NAME || peek(1).isOperator("{")))) {
                statements.add(readStatement());
            }
            namespace = namespaceNode(name, statements, null, listStart);
        }
        return finish(namespace, start);
    }

    private static Node namespaceNode(@Nullable Node name, List<Node> statements, @Nullable String value, int listStart) {
        var children = new ArrayList<Node>(statements.size() + 1);
        children.add(name);
        children.addAll(statements);
        var namespace = new Node(NodeKind.NAMESPACE, value, children);
        namespace.putAttribute(PhpParser.LIST_START, listStart);
        return namespace;
    }

    private Node readStatement() throws ParseException {
        var doc = docCommentBefore();
        int start = doc != null ? doc.start() : peek().start();
        var statement = readStatementBody();
        if (doc != null) {
            statement.setDocComment(new DocComment(doc.text(), new SourceSpan(doc.start(), doc.end())));
        }
        return finish(statement, start);
    }

    private Node readStatementBody() throws ParseException {
        var token = peek();
        if (token.isOperator("{")) {
            return readBlock();
        }
        if (token.type() == TokenType.NAME) {
            switch (token.text().toLowerCase(Locale.ROOT)) {
                case "use":
                    return readUse();
                case "declare":
                    return readDeclare();
                case "abstract":
                case "final":
                case "readonly":
                case "class":
                    return readClass();
                case "interface":
                    return readInterface();
                case "function":
                    if (peek(1).type() == TokenType.NAME || (peek(1).isOperator("&") && peek(2).type() == TokenType.NAME)) {
                        return readFunction();
                    }
                    break;
                case "if":
                    next();
                    return readIfTail();
                case "foreach":
                    return readForeach();
                case "while":
                    return readWhile();
                case "return": {
                    next();
                    Node expression = peek().isOperator(";") ? null : readExpression();
                    expect(";");
                    return Node.of(NodeKind.RETURN, expression);
                }
                case "echo": {
                    next();
                    var expressions = new ArrayList<Node>();
                    do {
                        expressions.add(readExpression());
                    } while (accept(","));
                    expect(";");
                    return new Node(NodeKind.ECHO, null, expressions);
                }
                case "throw": {
                    next();
                    var expression = readExpression();
                    expect(";");
                    return Node.of(NodeKind.THROW, expression);
                }
                case "trait", "try", "for", "switch", "do", "match", "enum", "goto", "global":
                    throw error("Unsupported syntax " + token, token);
                default:
                    break;
            }
        }
        var expression = readExpression();
        expect(";");
        return Node.of(NodeKind.EXPRESSION_STMT, expression);
    }

    private Node readBlock() throws ParseException {
        int start = expect("{").start();
        int listStart = lastEnd;
        var statements = new ArrayList<Node>();
        while (!peek().isOperator("}")) {
            if (peek().type() == TokenType.EOF) {
                throw error("Missing '}'", peek());
            }
            statements.add(readStatement());
        }
        expect("}");
        var block = new Node(NodeKind.BLOCK, null, statements);
        block.putAttribute(PhpParser.LIST_START, listStart);
        return finish(block, start);
    }

    private Node readUse() throws ParseException {
        next();
        String kind = null;
        if ((peek().isKeyword("function") || peek().isKeyword("const")) && peek(1).type() == TokenType.NAME) {
            kind = next().text().toLowerCase(Locale.ROOT);
        }
        int listStart = peek().start();
        var items = new ArrayList<Node>();
        do {
            int start = peek().start();
            var name = readName();
            String alias = null;
            if (acceptKeyword("as")) {
                alias = expectType(TokenType.NAME).text();
            }
            var item = Node.of(NodeKind.USE_ITEM, name);
            item.setValue(alias);
            items.add(finish(item, start));
        } while (accept(","));
        expect(";");
        var use = new Node(NodeKind.USE, kind, items);
        use.putAttribute(PhpParser.LIST_START, listStart);
        return use;
    }

    private Node readDeclare() throws ParseException {
        int start = next().start();
        expect("(");
        int depth = 1;
        while (depth > 0) {
            var token = next();
            if (token.type() == TokenType.EOF) {
                throw error("Unterminated declare", token);
            }
            if (token.isOperator("(")) {
                depth++;
            } else if (token.isOperator(")")) {
                depth--;
            }
        }
        expect(";");
        return Node.leaf(NodeKind.DECLARE, source.substring(start, lastEnd));
    }

    private Node readClass() throws ParseException {
        var modifiers = readModifiers(CLASS_MODIFIERS);
        expectKeyword("class");
        var identifier = readIdentifier();
        Node parent = null;
        if (acceptKeyword("extends")) {
            parent = readName();
        }
        Node interfaces = null;
        if (peek().isKeyword("implements")) {
            next();
            interfaces = readNameList();
        }
        expect("{");
        int listStart = lastEnd;
        var children = new ArrayList<Node>();
        children.add(modifiers);
        children.add(identifier);
        children.add(parent);
        children.add(interfaces);
        readMembers(children);
        var node = new Node(NodeKind.CLASS, null, children);
        node.putAttribute(PhpParser.LIST_START, listStart);
        return node;
    }

    private Node readInterface() throws ParseException {
        next();
        var identifier = readIdentifier();
        Node parents = null;
        if (acceptKeyword("extends")) {
            parents = readNameList();
        }
        expect("{");
        int listStart = lastEnd;
        var children = new ArrayList<Node>();
        children.add(identifier);
        children.add(parents);
        readMembers(children);
        var node = new Node(NodeKind.INTERFACE, null, children);
        node.putAttribute(PhpParser.LIST_START, listStart);
        return node;
    }

    private Node readNameList() throws ParseException {
        int start = peek().start();
        var names = new ArrayList<Node>();
        do {
            names.add(readName());
        } while (accept(","));
        var list = new Node(NodeKind.NAME_LIST, null, names);
        list.putAttribute(PhpParser.LIST_START, start);
        return finish(list, start);
    }

    private void readMembers(List<Node> children) throws ParseException {
        while (!peek().isOperator("}")) {
            if (peek().type() == TokenType.EOF) {
                throw error("Missing '}'", peek());
            }
            children.add(readMember());
        }
        expect("}");
    }

    private Node readMember() throws ParseException {
        var doc = docCommentBefore();
        int start = doc != null ? doc.start() : peek().start();
        if (peek().isKeyword("use")) {
            throw error("Trait uses are not supported", peek());
        }
        var modifiers = readModifiers(MEMBER_MODIFIERS);
        Node member;
        if (acceptKeyword("const")) {
            int listStart = peek().start();
            var items = new ArrayList<Node>();
            items.add(modifiers);
            do {
                int itemStart = peek().start();
                var identifier = readIdentifier();
                expect("=");
                var value = readExpression();
                items.add(finish(Node.of(NodeKind.CONST_ITEM, identifier, value), itemStart));
            } while (accept(","));
            expect(";");
            member = new Node(NodeKind.CLASS_CONST, null, items);
            member.putAttribute(PhpParser.LIST_START, listStart);
        } else if (acceptKeyword("function")) {
            boolean byReference = accept("&");
            var identifier = readIdentifier();
            var params = readParams();
            var returnType = readReturnType();
            Node body = null;
            if (!accept(";")) {
                body = readBlock();
            }
            member = Node.of(NodeKind.METHOD, modifiers, identifier, params, returnType, body);
            member.setValue(byReference ? "&" : null);
        } else {
            if (modifiers == null) {
                throw error("Expected a class member", peek());
            }
            Node type = peek().type() == TokenType.VARIABLE ? null : readType();
            int listStart = peek().start();
            var items = new ArrayList<Node>();
            items.add(modifiers);
            items.add(type);
            do {
                int itemStart = peek().start();
                var variable = readVariable();
                Node defaultValue = accept("=") ? readExpression() : null;
                items.add(finish(Node.of(NodeKind.PROPERTY_ITEM, variable, defaultValue), itemStart));
            } while (accept(","));
            expect(";");
            member = new Node(NodeKind.PROPERTY, null, items);
            member.putAttribute(PhpParser.LIST_START, listStart);
        }
        if (doc != null) {
            member.setDocComment(new DocComment(doc.text(), new SourceSpan(doc.start(), doc.end())));
        }
        return finish(member, start);
    }

    @Nullable
    private Node readModifiers(Set<String> allowed) {
        int start = peek().start();
        var keywords = new ArrayList<String>();
        while (peek().type() == TokenType.NAME && allowed.contains(peek().text().toLowerCase(Locale.ROOT))) {
            keywords.add(next().text());
        }
        if (keywords.isEmpty()) {
            return null;
        }
        return finish(Node.leaf(NodeKind.MODIFIERS, String.join(" ", keywords)), start);
    }

    private Node readFunction() throws ParseException {
        next();
        boolean byReference = accept("&");
        var identifier = readIdentifier();
        var params = readParams();
        var returnType = readReturnType();
        var body = readBlock();
        var function = Node.of(NodeKind.FUNCTION, identifier, params, returnType, body);
        function.setValue(byReference ? "&" : null);
        return function;
    }

    private Node readParams() throws ParseException {
        int start = expect("(").start();
        int listStart = lastEnd;
        var params = new ArrayList<Node>();
        while (!peek().isOperator(")")) {
            params.add(readParam());
            if (!accept(",")) {
                break;
            }
        }
        expect(")");
        var list = new Node(NodeKind.PARAM_LIST, null, params);
        list.putAttribute(PhpParser.LIST_START, listStart);
        return finish(list, start);
    }

    private Node readParam() throws ParseException {
        int start = peek().start();
        var modifiers = readModifiers(PROMOTION_MODIFIERS);
        Node type = null;
        if (!peek().isOperator("&") && !peek().isOperator("...") && peek().type() != TokenType.VARIABLE) {
            type = readType();
        }
        var flags = new StringBuilder();
        if (accept("&")) {
            flags.append('&');
        }
        if (accept("...")) {
            flags.append("...");
        }
        var variable = readVariable();
        Node defaultValue = accept("=") ? readExpression() : null;
        var param = Node.of(NodeKind.PARAM, modifiers, type, variable, defaultValue);
        param.setValue(flags.isEmpty() ? null : flags.toString());
        return finish(param, start);
    }

    @Nullable
    private Node readReturnType() throws ParseException {
        return accept(":") ? readType() : null;
    }

    private Node readType() throws ParseException {
        int start = peek().start();
        if (accept("?")) {
            return finish(Node.of(NodeKind.NULLABLE_TYPE, readSingleType()), start);
        }
        var first = readSingleType();
        if (!peek().isOperator("|")) {
            return first;
        }
        var members = new ArrayList<Node>();
        members.add(first);
        while (accept("|")) {
            members.add(readSingleType());
        }
        var union = new Node(NodeKind.UNION_TYPE, null, members);
        union.putAttribute(PhpParser.LIST_START, start);
        return finish(union, start);
    }

    private Node readSingleType() throws ParseException {
        var token = expectType(TokenType.NAME);
        var text = token.text();
        var kind = !text.contains("\\") && ResolvedType.isBuiltinTypeName(text) ? NodeKind.IDENTIFIER : NodeKind.NAME;
        return finish(Node.leaf(kind, text), token.start());
    }

    private Node readIfTail() throws ParseException {
        int start = lastStart();
        expect("(");
        var condition = readExpression();
        expect(")");
        var body = readStatement();
        Node elseNode = null;
        if (peek().isKeyword("elseif")) {
            int elseStart = next().start();
            var nested = readIfTail();
            var node = Node.of(NodeKind.ELSE, nested);
            node.setValue("elseif");
            elseNode = finish(node, elseStart);
        } else if (peek().isKeyword("else")) {
            int elseStart = next().start();
            Node nested;
            if (peek().isKeyword("if")) {
                int ifStart = next().start();
                nested = finish(readIfTail(), ifStart);
            } else {
                nested = readStatement();
            }
            elseNode = finish(Node.of(NodeKind.ELSE, nested), elseStart);
        }
        return finish(Node.of(NodeKind.IF, condition, body, elseNode), start);
    }

    private Node readForeach() throws ParseException {
        next();
        expect("(");
        var expression = readExpression();
        expectKeyword("as");
        Node key = null;
        boolean byReference = accept("&");
        var value = readExpression();
        if (!byReference && accept("=>")) {
            key = value;
            byReference = accept("&");
            value = readExpression();
        }
        expect(")");
        var body = readStatement();
        var foreach = Node.of(NodeKind.FOREACH, expression, key, value, body);
        foreach.setValue(byReference ? "&" : null);
        return foreach;
    }

    private Node readWhile() throws ParseException {
        next();
        expect("(");
        var condition = readExpression();
        expect(")");
        return Node.of(NodeKind.WHILE, condition, readStatement());
    }

    Node readExpression() throws ParseException {
        return readExpression(Precedence.LOWEST);
    }

    private Node readExpression(int minPrecedence) throws ParseException {
        int start = peek().start();
        var left = readUnary();
        while (true) {
            var token = peek();
            if (token.type() == TokenType.OPERATOR && Precedence.ASSIGNMENT_OPERATORS.contains(token.text())
                    && ASSIGNABLE.contains(left.kind())) {
                next();
                var right = readExpression(Precedence.ASSIGNMENT);
                var assign = Node.of(NodeKind.ASSIGN, left, right);
                assign.setValue(token.text());
                left = finish(assign, start);
                continue;
            }
            if (token.isOperator("?") && minPrecedence <= Precedence.TERNARY) {
                next();
                Node then = null;
                if (!peek().isOperator(":")) {
                    then = readExpression(Precedence.ASSIGNMENT);
                }
                expect(":");
                var otherwise = readExpression(Precedence.COALESCE);
                left = finish(Node.of(NodeKind.TERNARY, left, then, otherwise), start);
                continue;
            }
            if (token.isKeyword("instanceof") && minPrecedence <= Precedence.INSTANCEOF) {
                next();
                var type = readClassReference();
                left = finish(Node.of(NodeKind.INSTANCEOF, left, type), start);
                continue;
            }
            if (token.type() != TokenType.OPERATOR && !(token.type() == TokenType.NAME && Precedence.binary(token.text()) != -1)) {
                break;
            }
            int precedence = Precedence.binary(token.text());
            if (precedence == -1 || precedence < minPrecedence) {
                break;
            }
            next();
            var right = readExpression(Precedence.isRightAssociative(token.text()) ? precedence : precedence + 1);
            var binary = Node.of(NodeKind.BINARY_OP, left, right);
            binary.setValue(token.type() == TokenType.NAME ? token.text().toLowerCase(Locale.ROOT) : token.text());
            left = finish(binary, start);
        }
        return left;
    }

    private Node readUnary() throws ParseException {
        var token = peek();
        int start = token.start();
        if (token.type() == TokenType.OPERATOR) {
            switch (token.text()) {
                case "!":
                    next();
                    return finish(unary("!", readExpression(Precedence.NOT)), start);
                case "-":
                case "+":
                case "~":
                case "@":
                case "&":
                case "++":
                case "--":
                    next();
                    return finish(unary(token.text(), readExpression(Precedence.UNARY)), start);
                case "(":
                    if (peek(1).type() == TokenType.NAME && CASTS.contains(peek(1).text().toLowerCase(Locale.ROOT)) && peek(2).isOperator(")")) {
                        next();
                        var type = next().text();
                        next();
                        var operand = readExpression(Precedence.UNARY);
                        var cast = Node.of(NodeKind.CAST, operand);
                        cast.setValue(type);
                        return finish(cast, start);
                    }
                    next();
                    var inner = readExpression();
                    expect(")");
                    return readPostfix(inner, start);
                case "[":
                    return readPostfix(readArray(), start);
                default:
                    throw error("Unexpected " + token, token);
            }
        }
        if (token.type() == TokenType.NAME) {
            var keyword = token.text().toLowerCase(Locale.ROOT);
            if (PREFIX_KEYWORDS.contains(keyword)) {
                next();
                var operand = readExpression(Precedence.unary(keyword));
                return finish(unary(token.text(), operand), start);
            }
            switch (keyword) {
                case "new":
                    return readNew();
                case "function":
                case "fn":
                    return readPostfix(readClosure(null, start), start);
                case "static":
                    if (peek(1).isKeyword("function") || peek(1).isKeyword("fn")) {
                        next();
                        return readPostfix(readClosure("static", start), start);
                    }
                    break;
                case "array":
                    if (peek(1).isOperator("(")) {
                        return readPostfix(readArray(), start);
                    }
                    break;
                case "list", "match", "yield", "throw":
                    throw error("Unsupported syntax " + token, token);
                default:
                    break;
            }
        }
        return readPostfix(readPrimary(), start);
    }

    private static Node unary(String operator, Node operand) {
        var node = Node.of(NodeKind.UNARY_OP, operand);
        node.setValue(operator);
        return node;
    }

    private Node readPrimary() throws ParseException {
        var token = peek();
        int start = token.start();
        switch (token.type()) {
            case VARIABLE:
                return readVariable();
            case NUMBER:
                next();
                return finish(Node.leaf(NodeKind.NUMBER, token.text()), start);
            case STRING:
                next();
                return finish(Node.leaf(NodeKind.STRING, token.text()), start);
            case NAME: {
                var name = readName();
                if (peek().isOperator("(")) {
                    return finish(Node.of(NodeKind.FUNC_CALL, name, readArgs()), start);
                }
                if (peek().isOperator("::")) {
                    return name;
                }
                return finish(Node.of(NodeKind.CONST_FETCH, name), start);
            }
            default:
                throw error("Unexpected " + token, token);
        }
    }

    private Node readPostfix(Node node, int start) throws ParseException {
        while (true) {
            var token = peek();
            if (token.isOperator("[")) {
                next();
                Node dimension = peek().isOperator("]") ? null : readExpression();
                expect("]");
                node = finish(Node.of(NodeKind.ARRAY_DIM_FETCH, node, dimension), start);
            } else if (token.isOperator("->") || token.isOperator("?->")) {
                next();
                var member = readMemberName();
                String nullsafe = token.text().equals("?->") ? "?->" : null;
                Node access;
                if (peek().isOperator("(")) {
                    access = Node.of(NodeKind.METHOD_CALL, node, member, readArgs());
                } else {
                    access = Node.of(NodeKind.PROPERTY_FETCH, node, member);
                }
                access.setValue(nullsafe);
                node = finish(access, start);
            } else if (token.isOperator("::")) {
                next();
                if (peek().type() == TokenType.VARIABLE) {
                    node = finish(Node.of(NodeKind.STATIC_PROPERTY_FETCH, node, readVariable()), start);
                } else {
                    var identifier = readIdentifier();
                    if (peek().isOperator("(")) {
                        node = finish(Node.of(NodeKind.STATIC_CALL, node, identifier, readArgs()), start);
                    } else {
                        node = finish(Node.of(NodeKind.CLASS_CONST_FETCH, node, identifier), start);
                    }
                }
            } else if (token.isOperator("(") && !node.is(NodeKind.NAME)) {
                node = finish(Node.of(NodeKind.FUNC_CALL, node, readArgs()), start);
            } else if (token.isOperator("++") || token.isOperator("--")) {
                next();
                var postfix = Node.of(NodeKind.POSTFIX_OP, node);
                postfix.setValue(token.text());
                node = finish(postfix, start);
            } else {
                if (node.is(NodeKind.NAME)) {
                    throw error("Unexpected " + token, token);
                }
                return node;
            }
        }
    }

    private Node readMemberName() throws ParseException {
        if (peek().type() == TokenType.VARIABLE) {
            return readVariable();
        }
        return readIdentifier();
    }

    private Node readNew() throws ParseException {
        int start = next().start();
        if (peek().isKeyword("class")) {
            throw error("Anonymous classes are not supported", peek());
        }
        var type = readClassReference();
        Node args = peek().isOperator("(") ? readArgs() : null;
        return finish(Node.of(NodeKind.NEW, type, args), start);
    }

    private Node readClassReference() throws ParseException {
        if (peek().type() == TokenType.VARIABLE) {
            return readVariable();
        }
        return readName();
    }

    private Node readClosure(@Nullable String modifier, int start) throws ParseException {
        boolean arrow = next().isKeyword("fn");
        boolean byReference = accept("&");
        var params = readParams();
        if (arrow) {
            var returnType = readReturnType();
            expect("=>");
            var expression = readExpression(Precedence.ASSIGNMENT);
            var function = Node.of(NodeKind.ARROW_FUNCTION, params, returnType, expression);
            function.setValue(modifier);
            return finish(function, start);
        }
        Node uses = null;
        if (acceptKeyword("use")) {
            int usesStart = expect("(").start();
            int listStart = lastEnd;
            var variables = new ArrayList<Node>();
            while (!peek().isOperator(")")) {
                int itemStart = peek().start();
                if (accept("&")) {
                    variables.add(finish(unary("&", readVariable()), itemStart));
                } else {
                    variables.add(readVariable());
                }
                if (!accept(",")) {
                    break;
                }
            }
            expect(")");
            uses = new Node(NodeKind.CLOSURE_USES, null, variables);
            uses.putAttribute(PhpParser.LIST_START, listStart);
            finish(uses, usesStart);
        }
        var returnType = readReturnType();
        var body = readBlock();
        var closure = Node.of(NodeKind.CLOSURE, params, uses, returnType, body);
        closure.setValue(modifier != null ? modifier : byReference ? "&" : null);
        return finish(closure, start);
    }

    private Node readArray() throws ParseException {
        int start = peek().start();
        String closer;
        String value = null;
        if (accept("[")) {
            closer = "]";
        } else {
            value = next().text() + "(";
            expect("(");
            closer = ")";
        }
        int listStart = lastEnd;
        var items = new ArrayList<Node>();
        while (!peek().isOperator(closer)) {
            if (peek().isOperator(",")) {
                throw error("Empty array items are not supported", peek());
            }
            items.add(readArrayItem());
            if (!accept(",")) {
                break;
            }
        }
        expect(closer);
        var array = new Node(NodeKind.ARRAY, value, items);
        array.putAttribute(PhpParser.LIST_START, listStart);
        return finish(array, start);
    }

    private Node readArrayItem() throws ParseException {
        int start = peek().start();
        if (accept("...")) {
            var item = Node.of(NodeKind.ARRAY_ITEM, null, readExpression());
            item.setValue("...");
            return finish(item, start);
        }
        boolean byReference = accept("&");
        var value = readExpression();
        Node key = null;
        if (!byReference && accept("=>")) {
            key = value;
            byReference = accept("&");
            value = readExpression();
        }
        var item = Node.of(NodeKind.ARRAY_ITEM, key, value);
        item.setValue(byReference ? "&" : null);
        return finish(item, start);
    }

    private Node readArgs() throws ParseException {
        int start = expect("(").start();
        int listStart = lastEnd;
        if (peek().isOperator("...") && peek(1).isOperator(")")) {
            next();
            next();
            var callable = new Node(NodeKind.ARG_LIST, "...", List.of());
            callable.putAttribute(PhpParser.LIST_START, listStart);
            return finish(callable, start);
        }
        var args = new ArrayList<Node>();
        while (!peek().isOperator(")")) {
            if (peek().type() == TokenType.NAME && peek(1).isOperator(":")) {
                throw error("Named arguments are not supported", peek());
            }
            int argStart = peek().start();
            boolean unpack = accept("...");
            var arg = Node.of(NodeKind.ARG, readExpression());
            arg.setValue(unpack ? "..." : null);
            args.add(finish(arg, argStart));
            if (!accept(",")) {
                break;
            }
        }
        expect(")");
        var list = new Node(NodeKind.ARG_LIST, null, args);
        list.putAttribute(PhpParser.LIST_START, listStart);
        return finish(list, start);
    }

    private Node readName() throws ParseException {
        var token = expectType(TokenType.NAME);
        return finish(Node.leaf(NodeKind.NAME, token.text()), token.start());
    }

    private Node readIdentifier() throws ParseException {
        var token = expectType(TokenType.NAME);
        if (token.text().contains("\\")) {
            throw error("Expected an identifier, got " + token, token);
        }
        return finish(Node.leaf(NodeKind.IDENTIFIER, token.text()), token.start());
    }

    private Node readVariable() throws ParseException {
        var token = expectType(TokenType.VARIABLE);
        return finish(Node.leaf(NodeKind.VARIABLE, token.text().substring(1)), token.start());
    }

    /**
     * The doc comment closest to the next token, if only whitespace and comments separate them.
     */
    @Nullable
    private Token docCommentBefore() {
        for (int i = index - 1; i >= 0 && tokens.get(i).type().isTrivia(); i--) {
            if (tokens.get(i).type() == TokenType.DOC_COMMENT) {
                return tokens.get(i);
            }
        }
        return null;
    }

    private Node finish(Node node, int start) {
        node.setSpan(new SourceSpan(start, lastEnd));
        return node;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token peek(int ahead) {
        int i = index;
        for (int k = 0; k < ahead && tokens.get(i).type() != TokenType.EOF; k++) {
            i = nextSignificant(i + 1);
        }
        return tokens.get(i);
    }

    private Token next() {
        var token = tokens.get(index);
        if (token.type() != TokenType.EOF) {
            lastEnd = token.end();
            index = nextSignificant(index + 1);
        }
        return token;
    }

    /**
     * Start offset of the token consumed last.
     */
    private int lastStart() {
        for (int i = index - 1; i >= 0; i--) {
            if (!tokens.get(i).type().isTrivia()) {
                return tokens.get(i).start();
            }
        }
        return 0;
    }

    private int nextSignificant(int i) {
        while (tokens.get(i).type().isTrivia()) {
            i++;
        }
        return i;
    }

    private boolean accept(String operator) {
        if (peek().isOperator(operator)) {
            next();
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            next();
            return true;
        }
        return false;
    }

    private Token expect(String operator) throws ParseException {
        if (!peek().isOperator(operator)) {
            throw error("Expected '" + operator + "', got " + peek(), peek());
        }
        return next();
    }

    private void expectKeyword(String keyword) throws ParseException {
        if (!peek().isKeyword(keyword)) {
            throw error("Expected '" + keyword + "', got " + peek(), peek());
        }
        next();
    }

    private Token expectType(TokenType type) throws ParseException {
        if (peek().type() != type) {
            throw error("Expected " + type.name().toLowerCase(Locale.ROOT) + ", got " + peek(), peek());
        }
        return next();
    }

    private ParseException error(String message, Token token) {
        return PhpParser.errorAt(source, message, token.start());
    }
}
