/*
 * Copyright (c) 2023 Daniel Maier.
 * Licensed under the MIT License.
 */

package net.scoreworks.tonelang.notation;

import java.util.ArrayList;
import java.util.List;


/**
 * First compiler pass. Builds a copy of the tree in which every element carries its effective modifiers: its own
 * values, completed top-down with the resolved values of the enclosing elements. Values that neither the element nor
 * any ancestor sets stay null and are defaulted by {@link TimelineFlattener}
 */
final class ModifierResolver implements SequenceElementVisitor<SequenceElement, Modifiers> {
    static final ModifierResolver INSTANCE = new ModifierResolver();

    private ModifierResolver() {}

    Voice resolve(Voice voice) {
        return new Voice(resolveAll(voice.getElements(), Modifiers.NONE));
    }

    private List<SequenceElement> resolveAll(List<SequenceElement> elements, Modifiers inherited) {
        List<SequenceElement> resolved = new ArrayList<>(elements.size());
        for (SequenceElement element : elements) {
            resolved.add(element.accept(this, inherited));
        }
        return resolved;
    }

    @Override
    public SequenceElement visitNote(Note note, Modifiers inherited) {
        return new Note(note.getPitch(), note.getModifiers().inheritFrom(inherited));
    }

    @Override
    public SequenceElement visitChord(Chord chord, Modifiers inherited) {
        Modifiers resolved = chord.getModifiers().inheritFrom(inherited);
        //chord notes never move the cursor themselves
        Modifiers forNotes = resolved.withoutTimeUntilNext();
        List<ChordNote> notes = new ArrayList<>(chord.getNotes().size());
        for (ChordNote note : chord.getNotes()) {
            notes.add(new ChordNote(note.getPitch(), note.getModifiers().inheritFrom(forNotes)));
        }
        return new Chord(notes, resolved);
    }

    @Override
    public SequenceElement visitRest(Rest rest, Modifiers inherited) {
        Modifiers resolved = rest.getModifiers().inheritFrom(inherited).onlyDuration();
        return resolved.getDuration() == null ? new Rest() : new Rest(resolved.getDuration());
    }

    @Override
    public SequenceElement visitGrouping(Grouping grouping, Modifiers inherited) {
        Modifiers resolved = grouping.getModifiers().inheritFrom(inherited);
        return new Grouping(resolveAll(grouping.getContent(), resolved), resolved);
    }

    @Override
    public SequenceElement visitRepetition(Repetition repetition, Modifiers inherited) {
        //resolved once, every pass plays the same content
        Modifiers resolved = repetition.getModifiers().inheritFrom(inherited);
        return new Repetition(resolveAll(repetition.getContent(), resolved), repetition.getRepeat(), resolved);
    }
}
