package guraa.wiringdoc.core;

import guraa.wiringdoc.exception.ConfigurationException;
import guraa.wiringdoc.model.CroppedPage;
import guraa.wiringdoc.model.PlanTrack;
import guraa.wiringdoc.model.TrackLengthPolicy;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Interleaves ordered page tracks into one sequence: the first page of every
 * track, then the second page of every track, and so on. Tracks that run out
 * are skipped; nothing is padded.
 */
@Component
public class RiffleShuffler {

    /**
     * Interleave tracks in declared order.
     *
     * @param tracks The tracks, each already in its own order
     * @param <T> The element type
     * @return A new list holding every element of every track exactly once
     */
    public <T> List<T> shuffle(List<? extends List<? extends T>> tracks) {
        if (tracks == null || tracks.isEmpty()) {
            return new ArrayList<>();
        }

        int remaining = tracks.stream().mapToInt(List::size).sum();
        List<T> result = new ArrayList<>(remaining);
        int[] cursors = new int[tracks.size()];

        while (remaining > 0) {
            for (int i = 0; i < tracks.size(); i++) {
                List<? extends T> track = tracks.get(i);
                if (cursors[i] < track.size()) {
                    result.add(track.get(cursors[i]++));
                    remaining--;
                }
            }
        }
        return result;
    }

    /**
     * Interleave the plan tracks of one room.
     *
     * @param room The room, for error messages
     * @param tracks The room's tracks in tab order, then track order
     * @param policy How unequal track lengths are treated
     * @return The room's plan pages in output order
     * @throws ConfigurationException If the policy is strict and the track lengths differ
     */
    public List<CroppedPage> shuffle(String room, List<PlanTrack> tracks, TrackLengthPolicy policy) {
        if (policy == TrackLengthPolicy.STRICT) {
            requireEqualLengths(room, tracks);
        }
        return shuffle(tracks.stream().map(PlanTrack::getPages).collect(Collectors.toList()));
    }

    private static void requireEqualLengths(String room, List<PlanTrack> tracks) {
        long distinctLengths = tracks.stream().mapToInt(track -> track.getPages().size()).distinct().count();
        if (distinctLengths <= 1) {
            return;
        }
        String lengths = tracks.stream()
                .map(track -> track.label() + ": " + track.getPages().size())
                .collect(Collectors.joining(", "));
        throw ConfigurationException.of("room '" + room + "': tracks have unequal page counts (" + lengths + ")");
    }
}
