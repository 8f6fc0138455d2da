package ai.gametree;

import ai.gametree.config.SearchDriverFactory;
import ai.gametree.game.GameAdapter;
import ai.gametree.player.PlayResult;
import ai.gametree.player.SearchDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point: one search driver plays both sides of a game against itself.
 *
 * <p>Search settings come from {@code search.*} properties, for example
 * {@code --search.expansion=FULL --search.debug=true}.
 */
@SpringBootApplication
public class GameTreeApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(GameTreeApplication.class);

    private final GameAdapter<?, ?, ?> adapter;
    private final SearchDriverFactory driverFactory;

    public GameTreeApplication(GameAdapter<?, ?, ?> adapter, SearchDriverFactory driverFactory) {
        this.adapter = adapter;
        this.driverFactory = driverFactory;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(GameTreeApplication.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        // The result is only logged here; tests call play() directly.
        play();
    }

    /**
     * Plays one self-play game with a freshly configured driver.
     *
     * @return winner, number of plies and duration
     */
    public PlayResult<?> play() {
        return play(adapter);
    }

    private <S, M, P> PlayResult<P> play(GameAdapter<S, M, P> game) {
        SearchDriver<S, M, P> driver = driverFactory.create(game);
        PlayResult<P> result = driver.play();
        log.info("Game finished after {} plies in {} ms: {} (final tree size {})",
                result.plies(),
                result.durationNanos() / 1_000_000,
                result.isDraw() ? "draw" : result.winner() + " wins",
                driver.numStates());
        log.info("Final position:{}{}", System.lineSeparator(), game.render(driver.getCurrentState()));
        return result;
    }
}
