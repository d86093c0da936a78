package io.github.hongjungwan.jsonlog.core.internal;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;

import java.io.IOException;

/**
 * 고정 폭 들여쓰기 PrettyPrinter. 멤버와 배열 원소를 한 줄에 하나씩, 키와 값 사이는 ": ".
 */
class IndentingPrettyPrinter extends DefaultPrettyPrinter {

    private static final long serialVersionUID = 1L;

    private final int indent;

    IndentingPrettyPrinter(int indent) {
        this.indent = indent;
        DefaultIndenter indenter = new DefaultIndenter(" ".repeat(indent), "\n");
        indentObjectsWith(indenter);
        indentArraysWith(indenter);
    }

    // DefaultPrettyPrinter는 서브클래스가 createInstance를 재정의하지 않으면 예외를 던짐
    @Override
    public DefaultPrettyPrinter createInstance() {
        return new IndentingPrettyPrinter(indent);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }
}
