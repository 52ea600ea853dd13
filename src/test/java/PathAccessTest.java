import static com.tinyscript.script.ast.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.tinyscript.script.runtime.Instance;
import com.tinyscript.script.runtime.PathAccess;
import com.tinyscript.script.runtime.ScriptClass;
import com.tinyscript.script.runtime.ScriptError;
import com.tinyscript.script.runtime.Value;

public class PathAccessTest {

    /** {"a": {"b": {"c": {"x": 1}}}} */
    private static Value nested() {
        Value c = Value.dict();
        c.asDict().put("x", Value.number(1));
        Value b = Value.dict();
        b.asDict().put("c", c);
        Value a = Value.dict();
        a.asDict().put("b", b);
        Value root = Value.dict();
        root.asDict().put("a", a);
        return root;
    }

    private static List<String> keys(String... k) {
        return Arrays.asList(k);
    }

    @Test
    void writeThenRead_roundTripsAtEveryDepth() {
        Value d = nested();
        for (int depth = 1; depth <= 4; depth++) {
            List<String> path = keys("a", "b", "c", "x").subList(0, depth - 1);
            List<String> full = new ArrayList<>(path);
            full.add("k" + depth);

            Value v = Value.string("v" + depth);
            PathAccess.write(d, full, v);
            assertSame(v, PathAccess.read(d, full));
        }
    }

    @Test
    void mutationThroughPath_visibleThroughAlias() {
        Value d = nested();
        Value r = PathAccess.read(d, keys("a"));

        PathAccess.write(d, keys("a", "b", "x"), Value.number(1));

        assertEquals(1L, PathAccess.read(r, keys("b", "x")).asLong());
    }

    @Test
    void leafReplacedByContainer_canBeExtended() {
        Value d = nested();
        Value person = Value.dict();
        person.asDict().put("name", Value.string("ada"));

        PathAccess.write(d, keys("a", "b", "c", "x"), person);
        assertEquals("ada", PathAccess.read(d, keys("a", "b", "c", "x", "name")).asString());

        PathAccess.write(d, keys("a", "b", "c", "x", "age"), Value.number(36));
        assertEquals(36L, person.asDict().get("age").asLong());
    }

    @Test
    void missingIntermediate_isKeyNotFound_neverAutoVivified() {
        Value d = nested();

        ScriptError ex = assertThrows(ScriptError.class,
                () -> PathAccess.write(d, keys("a", "missing", "x"), Value.number(1)));
        assertEquals(ScriptError.Kind.KEY_NOT_FOUND, ex.kind());
        assertFalse(PathAccess.read(d, keys("a")).asDict().containsKey("missing"));
    }

    @Test
    void missingLeafOnRead_isKeyNotFound() {
        ScriptError ex = assertThrows(ScriptError.class, () -> PathAccess.read(nested(), keys("a", "nope")));
        assertEquals(ScriptError.Kind.KEY_NOT_FOUND, ex.kind());
    }

    @Test
    void scalarIntermediate_isTypeMismatch() {
        ScriptError ex = assertThrows(ScriptError.class,
                () -> PathAccess.write(nested(), keys("a", "b", "c", "x", "deeper"), Value.number(1)));
        assertEquals(ScriptError.Kind.TYPE_MISMATCH, ex.kind());
    }

    @Test
    void instanceRead_fieldFirstThenBoundMethod() {
        ScriptClass cls = new ScriptClass(clazz("Point",
                Collections.singletonList(field("x", num(1))),
                function("norm", params(), ret(num(0)))));
        Value p = Value.instance(new Instance(cls));
        p.asInstance().setField("x", Value.number(3));

        assertEquals(3L, PathAccess.getMember(p, "x").asLong());

        Value m = PathAccess.getMember(p, "norm");
        assertEquals(Value.Type.FUNCTION, m.type);
        assertTrue(m.asFunction().isBound());
        assertSame(p, m.asFunction().self());

        ScriptError ex = assertThrows(ScriptError.class, () -> PathAccess.getMember(p, "y"));
        assertEquals(ScriptError.Kind.MEMBER_NOT_FOUND, ex.kind());
    }

    @Test
    void instanceFieldMayShadowMethod_methodTableUntouched() {
        ScriptClass cls = new ScriptClass(clazz("Box", function("size", params(), ret(num(1)))));
        Value box = Value.instance(new Instance(cls));

        PathAccess.setMember(box, "size", Value.number(99));

        assertEquals(99L, PathAccess.getMember(box, "size").asLong());
        assertNotNull(cls.findMethod("size"));
    }

    @Test
    void classRead_returnsUnboundMethod() {
        ScriptClass cls = new ScriptClass(clazz("Util", function("one", params(), ret(num(1)))));
        Value c = Value.clazz(cls);

        Value m = PathAccess.getMember(c, "one");
        assertFalse(m.asFunction().isBound());

        ScriptError ex = assertThrows(ScriptError.class, () -> PathAccess.getMember(c, "two"));
        assertEquals(ScriptError.Kind.MEMBER_NOT_FOUND, ex.kind());
    }

    @Test
    void listIndex_readWriteAndAppend() {
        Value l = Value.list();
        PathAccess.setIndex(l, Value.number(0), Value.string("a")); // append at size
        PathAccess.setIndex(l, Value.number(1), Value.string("b"));
        PathAccess.setIndex(l, Value.number(0), Value.string("A"));

        assertEquals("A", PathAccess.getIndex(l, Value.number(0)).asString());
        assertEquals(2, l.asList().size());

        ScriptError read = assertThrows(ScriptError.class, () -> PathAccess.getIndex(l, Value.number(2)));
        assertEquals(ScriptError.Kind.INDEX_OUT_OF_RANGE, read.kind());

        ScriptError write = assertThrows(ScriptError.class,
                () -> PathAccess.setIndex(l, Value.number(5), Value.nil()));
        assertEquals(ScriptError.Kind.INDEX_OUT_OF_RANGE, write.kind());

        ScriptError frac = assertThrows(ScriptError.class, () -> PathAccess.getIndex(l, Value.number(0.5)));
        assertEquals(ScriptError.Kind.TYPE_MISMATCH, frac.kind());
    }

    @Test
    void dictIndex_followsMemberRules() {
        Value d = Value.dict();
        PathAccess.setIndex(d, Value.string("k"), Value.number(1));
        assertEquals(1L, PathAccess.getIndex(d, Value.string("k")).asLong());

        ScriptError ex = assertThrows(ScriptError.class, () -> PathAccess.getIndex(d, Value.string("z")));
        assertEquals(ScriptError.Kind.KEY_NOT_FOUND, ex.kind());
    }
}
