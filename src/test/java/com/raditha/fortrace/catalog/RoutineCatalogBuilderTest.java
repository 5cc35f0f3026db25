package com.raditha.fortrace.catalog;

import com.raditha.fortrace.model.RoutineEntry;
import com.raditha.fortrace.model.SourceUnit;
import com.raditha.fortrace.model.UnitKind;
import net.jqwik.api.ForAll;
import net.jqwik.api.lifecycle.BeforeTry;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RoutineCatalogBuilderTest {

    private RoutineCatalogBuilder builder;

    @BeforeEach
    @BeforeTry
    void setUp() {
        builder = new RoutineCatalogBuilder();
    }

    @Test
    void testProgramWithInternalRoutines() {
        String source = """
                program demo
                  implicit none
                  call greet
                contains
                  subroutine greet
                    print *, 'hi'
                  end subroutine greet
                  integer function twice(n)
                    integer, intent(in) :: n
                    twice = 2 * n
                  end function twice
                end program demo
                """;

        SourceUnit unit = builder.build(source.lines().toList());

        assertEquals(UnitKind.PROGRAM, unit.kind());
        assertEquals(Optional.of("demo"), unit.name());
        assertEquals(List.of(new RoutineEntry("greet", 4, 6), new RoutineEntry("twice", 7, 10)), unit.routines());
        assertEquals(Optional.of(new RoutineEntry("demo", 0, 11)), unit.mainProgram());
    }

    @Test
    void testModule() {
        String source = """
                module geometry
                  use constants
                contains
                  pure real function area(r)
                    real, intent(in) :: r
                    area = pi * r * r
                  end function area
                  recursive subroutine walk(node)
                    call walk(node)
                  end subroutine
                  function g(x) result(y)
                    y = x
                  end function g
                end module geometry
                """;

        SourceUnit unit = builder.build(source.lines().toList());

        assertEquals(UnitKind.MODULE, unit.kind());
        assertEquals(Optional.of("geometry"), unit.name());
        assertEquals(List.of("area", "walk", "g"), unit.routines().stream().map(RoutineEntry::name).toList());
        assertEquals(new RoutineEntry("walk", 7, 9), unit.routines().get(1));
        assertTrue(unit.mainProgram().isEmpty());
    }

    @Test
    void testModuleProcedureIsNotAModule() {
        SourceUnit unit = builder.build(List.of("module procedure swap_int"));
        assertEquals(UnitKind.FLAT_ROUTINES, unit.kind());
        assertTrue(unit.name().isEmpty());
    }

    @Test
    void testFlatRoutinesWithBareEnd() {
        String source = """
                ! utilities
                subroutine first(a)
                  a = 1
                end
                SUBROUTINE SECOND
                END SUBROUTINE SECOND
                """;

        SourceUnit unit = builder.build(source.lines().toList());

        assertEquals(UnitKind.FLAT_ROUTINES, unit.kind());
        assertTrue(unit.name().isEmpty());
        assertEquals(List.of(new RoutineEntry("first", 1, 3), new RoutineEntry("second", 4, 5)), unit.routines());
    }

    @Test
    void testBareEndClosesProgram() {
        SourceUnit unit = builder.build(List.of("program p", "  x = 1", "end"));
        assertEquals(Optional.of(new RoutineEntry("p", 0, 2)), unit.mainProgram());
        assertTrue(unit.routines().isEmpty());
    }

    @Test
    void testProgramAfterFlatRoutines() {
        String source = """
                subroutine helper
                end subroutine helper
                program main
                  call helper
                end program main
                """;

        SourceUnit unit = builder.build(source.lines().toList());

        assertEquals(UnitKind.FLAT_ROUTINES, unit.kind());
        assertEquals(List.of(new RoutineEntry("helper", 0, 1)), unit.routines());
        assertEquals(Optional.of(new RoutineEntry("main", 2, 4)), unit.mainProgram());
    }

    @Test
    void testInterfaceBlocksAreSkipped() {
        String source = """
                program p
                  interface
                    subroutine external_thing(x)
                      real :: x
                    end subroutine external_thing
                  end interface
                  call external_thing(1.0)
                end program p
                """;

        SourceUnit unit = builder.build(source.lines().toList());

        assertTrue(unit.routines().isEmpty());
        assertEquals(Optional.of(new RoutineEntry("p", 0, 7)), unit.mainProgram());
    }

    @Test
    void testBlockEndsDoNotCloseRoutines() {
        String source = """
                subroutine s
                  do i = 1, 2
                    if (i > 1) then
                      x = 1
                    end if
                  end do
                end subroutine s
                """;

        SourceUnit unit = builder.build(source.lines().toList());
        assertEquals(List.of(new RoutineEntry("s", 0, 6)), unit.routines());
    }

    @Test
    void testUnterminatedRoutineIsDropped() {
        SourceUnit unit = builder.build(List.of("subroutine never_closed", "  x = 1"));
        assertTrue(unit.routines().isEmpty());
    }

    @Test
    void testHeaderReplacesUnterminatedRoutine() {
        SourceUnit unit = builder.build(List.of("subroutine a", "subroutine b", "end subroutine b"));
        assertEquals(List.of(new RoutineEntry("b", 1, 2)), unit.routines());
    }

    @Test
    void testCommentedOutHeaderIsIgnored() {
        SourceUnit unit = builder.build(List.of("! subroutine ghost", "subroutine real_one", "end"));
        assertEquals(List.of(new RoutineEntry("real_one", 1, 2)), unit.routines());
    }

    @Test
    void testEmptyFile() {
        SourceUnit unit = builder.build(List.of());
        assertEquals(UnitKind.FLAT_ROUTINES, unit.kind());
        assertTrue(unit.routines().isEmpty());
        assertTrue(unit.mainProgram().isEmpty());
    }

    @Test
    void testBuildRequiringRoutines() {
        assertThrows(IllegalArgumentException.class, () -> builder.buildRequiringRoutines(List.of("x = 1")));
        assertEquals(1, builder.buildRequiringRoutines(List.of("subroutine s", "end")).routines().size());
    }

    @Test
    void testFindRoutineLastDefinitionWins() {
        SourceUnit unit = builder.build(List.of(
                "subroutine dup", "end subroutine dup",
                "subroutine dup", "  x = 1", "end subroutine dup"));

        assertEquals(Optional.of(new RoutineEntry("dup", 2, 4)), unit.findRoutine("DUP"));
        assertTrue(unit.findRoutine("missing").isEmpty());
    }

    /**
     * A program header followed by one subroutine yields a PROGRAM unit with
     * exactly that subroutine, whatever surrounds it.
     */
    @Property(tries = 100)
    void programWithOneSubroutine(
            @ForAll @IntRange(min = 0, max = 6) int before,
            @ForAll @IntRange(min = 0, max = 6) int inside,
            @ForAll @IntRange(min = 0, max = 6) int trailing) {
        List<String> lines = new ArrayList<>();
        lines.add("program p");
        addFiller(lines, before);
        lines.add("end program p");
        lines.add("subroutine s");
        addFiller(lines, inside);
        lines.add("end subroutine");
        addFiller(lines, trailing);

        SourceUnit unit = builder.build(lines);

        assertEquals(UnitKind.PROGRAM, unit.kind());
        assertEquals(Optional.of("p"), unit.name());
        assertEquals(List.of(new RoutineEntry("s", before + 2, before + 3 + inside)), unit.routines());
    }

    private static void addFiller(List<String> lines, int count) {
        for (int i = 0; i < count; i++) {
            lines.add(i % 2 == 0 ? "  x = x + 1" : "  ! comment");
        }
    }
}
