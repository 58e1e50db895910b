package fr.lapetina.lineplanner.infrastructure.config;

import fr.lapetina.lineplanner.domain.placement.LayoutSettings;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Root configuration object for the line planner.
 * Designed to be populated from YAML.
 */
public class LinePlannerConfig {

    private ServerConfig server = new ServerConfig();
    private LanesConfig lanes = new LanesConfig();
    private SpacingConfig spacing = new SpacingConfig();
    private FacingConfig facing = new FacingConfig();
    private SectionsConfig sections = new SectionsConfig();
    private FixturesConfig fixtures = new FixturesConfig();
    private DemandConfig demand = new DemandConfig();
    private MetricsConfig metrics = new MetricsConfig();

    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public LanesConfig getLanes() { return lanes; }
    public void setLanes(LanesConfig lanes) { this.lanes = lanes; }

    public SpacingConfig getSpacing() { return spacing; }
    public void setSpacing(SpacingConfig spacing) { this.spacing = spacing; }

    public FacingConfig getFacing() { return facing; }
    public void setFacing(FacingConfig facing) { this.facing = facing; }

    public SectionsConfig getSections() { return sections; }
    public void setSections(SectionsConfig sections) { this.sections = sections; }

    public FixturesConfig getFixtures() { return fixtures; }
    public void setFixtures(FixturesConfig fixtures) { this.fixtures = fixtures; }

    public DemandConfig getDemand() { return demand; }
    public void setDemand(DemandConfig demand) { this.demand = demand; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Converts this bean into the immutable settings used by the layout engine.
     *
     * @throws ConfigLoader.ConfigurationException if a value is out of range
     */
    public LayoutSettings toLayoutSettings() {
        validate();
        return new LayoutSettings(
                new LayoutSettings.LaneOffsets(lanes.laneA, lanes.laneB, lanes.laneC, lanes.laneD),
                new LayoutSettings.Spacing(
                        spacing.machinePitch,
                        spacing.sectionGap,
                        spacing.boardClearance,
                        spacing.boardHeight,
                        spacing.inspectionAlongOffset,
                        spacing.inspectionAcrossOffset,
                        spacing.trolleyAlongOffset,
                        spacing.trolleyAcrossOffset,
                        spacing.fixtureClearance,
                        spacing.transitionFixtureOffset,
                        spacing.transitionFixtureClearance
                ),
                new LayoutSettings.FacingYaws(facing.front, facing.back, facing.left, facing.right),
                new LayoutSettings.Keywords(
                        sections.assemblyKeywords,
                        sections.cdKeywords,
                        sections.abKeywords,
                        sections.buttoningKeywords,
                        sections.frontFacingKeywords
                ),
                fixtures.transitionFixtures
        );
    }

    private void validate() {
        requireSection("server", server);
        requireSection("lanes", lanes);
        requireSection("spacing", spacing);
        requireSection("facing", facing);
        requireSection("sections", sections);
        requireSection("fixtures", fixtures);
        requireSection("demand", demand);
        requireSection("metrics", metrics);

        if (spacing.machinePitch <= 0) {
            throw new ConfigLoader.ConfigurationException(
                    "spacing.machinePitch must be positive, got " + spacing.machinePitch);
        }
        double[] nonNegative = {
                spacing.sectionGap, spacing.boardClearance, spacing.inspectionAlongOffset,
                spacing.trolleyAlongOffset, spacing.fixtureClearance,
                spacing.transitionFixtureOffset, spacing.transitionFixtureClearance
        };
        for (double value : nonNegative) {
            if (value < 0) {
                throw new ConfigLoader.ConfigurationException("spacing values must not be negative, got " + value);
            }
        }
        Set<Double> offsets = new HashSet<>(List.of(lanes.laneA, lanes.laneB, lanes.laneC, lanes.laneD));
        if (offsets.size() != 4) {
            throw new ConfigLoader.ConfigurationException("lane offsets must be distinct");
        }
        requireKeywords("assemblyKeywords", sections.assemblyKeywords);
        requireKeywords("cdKeywords", sections.cdKeywords);
        requireKeywords("abKeywords", sections.abKeywords);
        requireKeywords("buttoningKeywords", sections.buttoningKeywords);
        requireKeywords("frontFacingKeywords", sections.frontFacingKeywords);
    }

    private static void requireSection(String name, Object section) {
        if (section == null) {
            throw new ConfigLoader.ConfigurationException("configuration section '" + name + "' must not be empty");
        }
    }

    // A blank keyword would match every label
    private static void requireKeywords(String name, List<String> keywords) {
        if (keywords == null) {
            throw new ConfigLoader.ConfigurationException("sections." + name + " must not be null");
        }
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) {
                throw new ConfigLoader.ConfigurationException("sections." + name + " must not contain blank keywords");
            }
        }
    }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 4;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    }

    /**
     * Across-line offset of each lane, metres.
     */
    public static class LanesConfig {
        private double laneA = -1.2;
        private double laneB = -2.8;
        private double laneC = 1.2;
        private double laneD = 2.8;

        public double getLaneA() { return laneA; }
        public void setLaneA(double laneA) { this.laneA = laneA; }

        public double getLaneB() { return laneB; }
        public void setLaneB(double laneB) { this.laneB = laneB; }

        public double getLaneC() { return laneC; }
        public void setLaneC(double laneC) { this.laneC = laneC; }

        public double getLaneD() { return laneD; }
        public void setLaneD(double laneD) { this.laneD = laneD; }
    }

    /**
     * Along-line spacing, metres.
     */
    public static class SpacingConfig {
        private double machinePitch = 2.0;
        private double sectionGap = 2.0;
        private double boardClearance = 1.5;
        private double boardHeight = 2.5;
        private double inspectionAlongOffset = 1.0;
        private double inspectionAcrossOffset = 0.0;
        private double trolleyAlongOffset = 3.5;
        private double trolleyAcrossOffset = 0.5;
        private double fixtureClearance = 2.5;
        private double transitionFixtureOffset = 1.0;
        private double transitionFixtureClearance = 2.5;

        public double getMachinePitch() { return machinePitch; }
        public void setMachinePitch(double machinePitch) { this.machinePitch = machinePitch; }

        public double getSectionGap() { return sectionGap; }
        public void setSectionGap(double sectionGap) { this.sectionGap = sectionGap; }

        public double getBoardClearance() { return boardClearance; }
        public void setBoardClearance(double boardClearance) { this.boardClearance = boardClearance; }

        public double getBoardHeight() { return boardHeight; }
        public void setBoardHeight(double boardHeight) { this.boardHeight = boardHeight; }

        public double getInspectionAlongOffset() { return inspectionAlongOffset; }
        public void setInspectionAlongOffset(double offset) { this.inspectionAlongOffset = offset; }

        public double getInspectionAcrossOffset() { return inspectionAcrossOffset; }
        public void setInspectionAcrossOffset(double offset) { this.inspectionAcrossOffset = offset; }

        public double getTrolleyAlongOffset() { return trolleyAlongOffset; }
        public void setTrolleyAlongOffset(double offset) { this.trolleyAlongOffset = offset; }

        public double getTrolleyAcrossOffset() { return trolleyAcrossOffset; }
        public void setTrolleyAcrossOffset(double offset) { this.trolleyAcrossOffset = offset; }

        public double getFixtureClearance() { return fixtureClearance; }
        public void setFixtureClearance(double fixtureClearance) { this.fixtureClearance = fixtureClearance; }

        public double getTransitionFixtureOffset() { return transitionFixtureOffset; }
        public void setTransitionFixtureOffset(double offset) { this.transitionFixtureOffset = offset; }

        public double getTransitionFixtureClearance() { return transitionFixtureClearance; }
        public void setTransitionFixtureClearance(double clearance) { this.transitionFixtureClearance = clearance; }
    }

    /**
     * Yaw angles in radians.
     */
    public static class FacingConfig {
        private double front = -Math.PI / 2;
        private double back = Math.PI / 2;
        private double left = Math.PI;
        private double right = 0.0;

        public double getFront() { return front; }
        public void setFront(double front) { this.front = front; }

        public double getBack() { return back; }
        public void setBack(double back) { this.back = back; }

        public double getLeft() { return left; }
        public void setLeft(double left) { this.left = left; }

        public double getRight() { return right; }
        public void setRight(double right) { this.right = right; }
    }

    /**
     * Keyword tables for section and station classification.
     */
    public static class SectionsConfig {
        private List<String> assemblyKeywords = new ArrayList<>(List.of("assembly"));
        private List<String> cdKeywords = new ArrayList<>(List.of("collar", "front"));
        private List<String> abKeywords = new ArrayList<>(List.of("cuff", "sleeve", "back"));
        private List<String> buttoningKeywords = new ArrayList<>(List.of("button"));
        private List<String> frontFacingKeywords = new ArrayList<>(List.of("iron", "press", "inspection"));

        public List<String> getAssemblyKeywords() { return assemblyKeywords; }
        public void setAssemblyKeywords(List<String> keywords) { this.assemblyKeywords = keywords; }

        public List<String> getCdKeywords() { return cdKeywords; }
        public void setCdKeywords(List<String> keywords) { this.cdKeywords = keywords; }

        public List<String> getAbKeywords() { return abKeywords; }
        public void setAbKeywords(List<String> keywords) { this.abKeywords = keywords; }

        public List<String> getButtoningKeywords() { return buttoningKeywords; }
        public void setButtoningKeywords(List<String> keywords) { this.buttoningKeywords = keywords; }

        public List<String> getFrontFacingKeywords() { return frontFacingKeywords; }
        public void setFrontFacingKeywords(List<String> keywords) { this.frontFacingKeywords = keywords; }
    }

    /**
     * Optional fixtures.
     */
    public static class FixturesConfig {
        private boolean transitionFixtures = false;

        public boolean isTransitionFixtures() { return transitionFixtures; }
        public void setTransitionFixtures(boolean transitionFixtures) { this.transitionFixtures = transitionFixtures; }
    }

    /**
     * Defaults applied when a request omits its demand figures.
     */
    public static class DemandConfig {
        private Double defaultTargetOutput;
        private double defaultWorkingMinutes = 480;

        public Double getDefaultTargetOutput() { return defaultTargetOutput; }
        public void setDefaultTargetOutput(Double defaultTargetOutput) { this.defaultTargetOutput = defaultTargetOutput; }

        public double getDefaultWorkingMinutes() { return defaultWorkingMinutes; }
        public void setDefaultWorkingMinutes(double minutes) { this.defaultWorkingMinutes = minutes; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "line_planner";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
