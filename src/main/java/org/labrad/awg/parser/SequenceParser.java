package org.labrad.awg.parser;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.labrad.awg.Constants;
import org.labrad.awg.description.ConditionalDescription;
import org.labrad.awg.description.LoopDescription;
import org.labrad.awg.description.ParameterValue;
import org.labrad.awg.description.Predicate;
import org.labrad.awg.description.PulseDescription;
import org.labrad.awg.description.Quantity;
import org.labrad.awg.description.SequenceDescription;
import org.labrad.awg.description.SequenceNode;
import org.labrad.awg.description.VariableDescription;
import org.labrad.awg.enums.Dimension;
import org.labrad.awg.enums.OutputChannel;
import org.labrad.awg.enums.PulseShape;
import org.labrad.awg.errors.SequenceSyntaxException;
import org.labrad.awg.errors.UnknownPresetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Queues;
import com.google.common.io.MoreFiles;

/**
 * Parses sequence text into a {@link SequenceDescription}.
 *
 * Lines are classified by {@link LineKind}; blank lines and lines starting
 * with '#' are skipped. Any error aborts the parse, no partial result is returned.
 */
public class SequenceParser {
  private static final Logger log = LoggerFactory.getLogger(SequenceParser.class);

  private static final Splitter COMMA = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Pattern FLAG = Pattern.compile("\\[\\s*(fixed|concurrent)\\s*\\]", Pattern.CASE_INSENSITIVE);
  private static final Pattern COMPARISON = Pattern.compile("^(\\S+?)\\s*(==|!=|<=|>=|<|>)\\s*(\\S+)$");
  private static final Pattern CHANNEL = Pattern.compile("^\\d+$");

  private final PresetRegistry presets;

  public SequenceParser() {
    this(PresetRegistry.empty());
  }

  public SequenceParser(PresetRegistry presets) {
    this.presets = Preconditions.checkNotNull(presets);
  }

  /**
   * Parse with presets scoped to this one call.
   */
  public static SequenceDescription parse(String source, PresetRegistry presets) {
    return new SequenceParser(presets).parse(source);
  }

  public static SequenceDescription parseFile(Path file, PresetRegistry presets) throws IOException {
    return new SequenceParser(presets).parseFile(file);
  }

  public SequenceDescription parseFile(Path file) throws IOException {
    log.info("Parsing sequence file {}", file);
    return parse(MoreFiles.asCharSource(file, StandardCharsets.UTF_8).read());
  }

  public SequenceDescription parse(String source) {
    Preconditions.checkNotNull(source);
    ParseState state = new ParseState();
    int lineNumber = 0;
    for (String raw : Splitter.onPattern("\r?\n").split(source)) {
      lineNumber++;
      String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      parseLine(state, line, lineNumber);
    }
    if (state.blocks.size() > 1) {
      Block open = state.blocks.peek();
      throw new SequenceSyntaxException(open.line, open.keyword, "block is never closed with 'end'");
    }
    SequenceDescription seq = state.build();
    log.info("Parsed {}", seq);
    return seq;
  }

  private void parseLine(ParseState state, String line, int lineNumber) {
    for (LineKind kind : LineKind.values()) {
      Matcher m = kind.match(line);
      if (m == null) {
        continue;
      }
      log.debug("line {}: {} '{}'", lineNumber, kind, line);
      switch (kind) {
        case HEADER: parseHeader(state, m, lineNumber); break;
        case VARIABLE: parseVariable(state, m, lineNumber); break;
        case PRESET: loadPreset(state, m, lineNumber); break;
        case LOOP: openLoop(state, m, lineNumber); break;
        case IF: openConditional(state, m, lineNumber); break;
        case ELSE: switchToElse(state, lineNumber); break;
        case END: closeBlock(state, lineNumber); break;
        case PULSE: state.current().add(parsePulse(m, lineNumber)); break;
        default: throw new IllegalStateException("Unhandled line kind " + kind);
      }
      return;
    }
    throw new SequenceSyntaxException(lineNumber, firstToken(line), "unrecognized line");
  }

  private static String firstToken(String line) {
    int space = line.indexOf(' ');
    return space < 0 ? line : line.substring(0, space);
  }

  //
  // header and variables
  //

  private void parseHeader(ParseState state, Matcher m, int line) {
    if (state.headerLine > 0) {
      throw new SequenceSyntaxException(line, "sequence:", "duplicate header, first given on line " + state.headerLine);
    }
    if (state.blocks.size() > 1) {
      throw new SequenceSyntaxException(line, "sequence:", "header inside a block");
    }
    state.headerLine = line;
    for (Map.Entry<String, String> e : parseKeyValues(m.group(1), line).entrySet()) {
      String key = e.getKey();
      String value = e.getValue();
      if (key.equals("name")) {
        state.name = value;
      } else if (key.equals("type")) {
        state.type = value;
      } else if (key.equals("duration")) {
        Quantity d = Literals.parseQuantity(value, line, Dimension.TIME);
        if (d.signum() <= 0) {
          throw new SequenceSyntaxException(line, value, "duration must be positive");
        }
        state.duration = d;
      } else if (key.equals("sample_rate")) {
        Quantity rate = Literals.parseQuantity(value, line, Dimension.FREQUENCY, Dimension.DIMENSIONLESS);
        if (rate.signum() <= 0) {
          throw new SequenceSyntaxException(line, value, "sample rate must be positive");
        }
        state.sampleRate = rate.getValue();
      } else if (key.equals("repeat") || key.equals("repeat_count")) {
        state.repeatCount = Literals.parsePositiveInteger(value, line);
      } else {
        state.metadata.put(key, value);
      }
    }
  }

  private void parseVariable(ParseState state, Matcher m, int line) {
    if (state.blocks.size() > 1) {
      throw new SequenceSyntaxException(line, "variable", "variable declared inside a block");
    }
    String name = m.group(1);
    Map<String, String> params = parseKeyValues(m.group(2), line);
    for (String required : new String[] {"start", "stop", "steps"}) {
      if (!params.containsKey(required)) {
        throw new SequenceSyntaxException(line, name, "variable is missing '" + required + "'");
      }
    }
    for (String key : params.keySet()) {
      if (!key.equals("start") && !key.equals("stop") && !key.equals("steps")) {
        throw new SequenceSyntaxException(line, key, "unknown variable parameter");
      }
    }
    Quantity start = Literals.parseQuantity(params.get("start"), line);
    Quantity stop = Literals.parseQuantity(params.get("stop"), line);
    if (start.getDimension() != stop.getDimension()) {
      throw new SequenceSyntaxException(line, params.get("stop"), "stop has different units than start");
    }
    long steps = Literals.parsePositiveInteger(params.get("steps"), line);
    if (steps > Integer.MAX_VALUE) {
      throw new SequenceSyntaxException(line, params.get("steps"), "too many steps");
    }
    state.declare(new VariableDescription(name, start, stop, (int) steps), line);
  }

  private Map<String, String> parseKeyValues(String text, int line) {
    Map<String, String> values = Maps.newLinkedHashMap();
    for (String field : COMMA.split(text)) {
      int eq = field.indexOf('=');
      if (eq <= 0 || eq == field.length() - 1) {
        throw new SequenceSyntaxException(line, field, "expected key=value");
      }
      String key = field.substring(0, eq).trim().toLowerCase();
      if (values.containsKey(key)) {
        throw new SequenceSyntaxException(line, key, "duplicate key");
      }
      values.put(key, field.substring(eq + 1).trim());
    }
    return values;
  }

  private void loadPreset(ParseState state, Matcher m, int line) {
    String name = m.group(1);
    SequenceDescription preset = presets.get(name);
    if (preset == null) {
      throw new UnknownPresetException(line, name);
    }
    for (VariableDescription v : preset.getVariables()) {
      state.declare(v, line);
    }
    for (SequenceNode node : preset.getNodes()) {
      state.current().add(node);
    }
    log.debug("line {}: inserted preset '{}' ({} nodes)", line, name, preset.getNodes().size());
  }

  //
  // blocks
  //

  private void openLoop(ParseState state, Matcher m, int line) {
    Block block = new Block(BlockKind.LOOP, "loop", line);
    String count = m.group(1);
    block.iterations = Literals.parseParameter(count, line, Dimension.DIMENSIONLESS);
    if (!block.iterations.isVariable() && Literals.parsePositiveInteger(count, line) > Integer.MAX_VALUE) {
      throw new SequenceSyntaxException(line, count, "too many iterations");
    }
    if (m.group(2) != null) {
      block.start = Literals.parseParameter(m.group(2), line, Dimension.TIME);
    }
    state.blocks.push(block);
  }

  private void openConditional(ParseState state, Matcher m, int line) {
    Block block = new Block(BlockKind.IF, "if", line);
    block.predicate = parsePredicate(m.group(1).trim(), line);
    state.blocks.push(block);
  }

  private Predicate parsePredicate(String text, int line) {
    Matcher m = COMPARISON.matcher(text);
    if (m.matches()) {
      return new Predicate(Literals.parseParameter(m.group(1), line),
          Predicate.Operator.fromString(m.group(2)),
          Literals.parseParameter(m.group(3), line));
    }
    if (text.contains(" ")) {
      throw new SequenceSyntaxException(line, text, "malformed condition");
    }
    return Predicate.of(Literals.parseParameter(text, line));
  }

  private void switchToElse(ParseState state, int line) {
    Block block = state.blocks.peek();
    if (block.kind != BlockKind.IF || block.inElse) {
      throw new SequenceSyntaxException(line, "else", "'else' without matching 'if'");
    }
    block.inElse = true;
  }

  private void closeBlock(ParseState state, int line) {
    if (state.blocks.size() == 1) {
      throw new SequenceSyntaxException(line, "end", "'end' without an open block");
    }
    Block block = state.blocks.pop();
    SequenceNode node;
    if (block.kind == BlockKind.LOOP) {
      if (block.nodes.isEmpty()) {
        throw new SequenceSyntaxException(block.line, "loop", "loop body is empty");
      }
      node = new LoopDescription(block.iterations, block.start, block.nodes, block.line);
    } else {
      node = new ConditionalDescription(block.predicate, block.nodes, block.elseNodes, block.line);
    }
    state.current().add(node);
  }

  //
  // pulses
  //

  private PulseDescription parsePulse(Matcher m, int line) {
    String label = m.group(1);
    String channelToken = m.group(2);
    if (!CHANNEL.matcher(channelToken).matches() || !OutputChannel.isValid(Integer.parseInt(channelToken))) {
      throw new SequenceSyntaxException(line, channelToken, "channel must be between 1 and 6");
    }
    PulseDescription.Builder pulse = PulseDescription.builder(label,
        OutputChannel.fromId(Integer.parseInt(channelToken))).line(line);

    String rest = m.group(3);
    Matcher flags = FLAG.matcher(rest);
    while (flags.find()) {
      setFlag(pulse, flags.group(1));
    }
    rest = flags.replaceAll(" ");

    List<String> fields = Lists.newArrayList(COMMA.split(rest));
    if (fields.isEmpty()) {
      throw new SequenceSyntaxException(line, label, "pulse is missing its start time");
    }
    pulse.start(Literals.parseParameter(fields.get(0), line, Dimension.TIME));

    String shape = Constants.DEFAULT_PULSE_SHAPE;
    String duration = Constants.DEFAULT_PULSE_DURATION;
    String amplitude = Constants.DEFAULT_PULSE_AMPLITUDE;
    Map<String, String> keywords = Maps.newLinkedHashMap();
    int positional = 0;
    for (String field : fields.subList(1, fields.size())) {
      String lower = field.toLowerCase();
      if (lower.equals("fixed") || lower.equals("concurrent")) {
        setFlag(pulse, lower);
      } else if (field.contains("=")) {
        keywords.putAll(parseKeyValues(field, line));
      } else if (!keywords.isEmpty()) {
        throw new SequenceSyntaxException(line, field, "positional value after keyword parameters");
      } else {
        positional++;
        switch (positional) {
          case 1: shape = field; break;
          case 2: duration = field; break;
          case 3: amplitude = field; break;
          default: throw new SequenceSyntaxException(line, field, "too many pulse fields");
        }
      }
    }

    if (!PulseShape.isKnown(shape)) {
      throw new SequenceSyntaxException(line, shape, "unknown pulse shape");
    }
    PulseShape pulseShape = PulseShape.fromString(shape);
    pulse.shape(pulseShape);

    ParameterValue dur = Literals.parseParameter(duration, line, Dimension.TIME);
    if (!dur.isVariable() && dur.getLiteral().signum() <= 0) {
      throw new SequenceSyntaxException(line, duration, "duration must be positive");
    }
    pulse.duration(dur);

    for (Map.Entry<String, String> e : keywords.entrySet()) {
      String key = e.getKey();
      String value = e.getValue();
      if (key.equals("amplitude")) {
        amplitude = value;
      } else if (key.equals("phase")) {
        pulse.phase(Literals.parseParameter(value, line, Dimension.ANGLE, Dimension.DIMENSIONLESS));
      } else if (key.equals("frequency")) {
        pulse.frequency(Literals.parseParameter(value, line, Dimension.FREQUENCY));
      } else if (key.equals("file")) {
        pulse.file(value);
      } else {
        throw new SequenceSyntaxException(line, key, "unknown pulse parameter");
      }
    }
    pulse.amplitude(Literals.parseParameter(amplitude, line, Dimension.DIMENSIONLESS, Dimension.VOLTAGE));

    if (pulseShape == PulseShape.SINE && !keywords.containsKey("frequency")) {
      throw new SequenceSyntaxException(line, shape, "sine pulse requires frequency=");
    }
    if (pulseShape == PulseShape.LOADFILE && !keywords.containsKey("file")) {
      throw new SequenceSyntaxException(line, shape, "loadfile pulse requires file=");
    }
    return pulse.build();
  }

  private static void setFlag(PulseDescription.Builder pulse, String flag) {
    if (flag.equalsIgnoreCase("fixed")) {
      pulse.fixed(true);
    } else {
      pulse.concurrent(true);
    }
  }

  //
  // parse state, local to one invocation
  //

  private enum BlockKind { ROOT, LOOP, IF }

  private static class Block {
    final BlockKind kind;
    final String keyword;
    final int line;
    final List<SequenceNode> nodes = Lists.newArrayList();
    final List<SequenceNode> elseNodes = Lists.newArrayList();
    boolean inElse;
    ParameterValue iterations;
    ParameterValue start;
    Predicate predicate;

    Block(BlockKind kind, String keyword, int line) {
      this.kind = kind;
      this.keyword = keyword;
      this.line = line;
    }

    void add(SequenceNode node) {
      if (inElse) {
        elseNodes.add(node);
      } else {
        nodes.add(node);
      }
    }
  }

  private static class ParseState {
    final Deque<Block> blocks = Queues.newArrayDeque();
    final Map<String, VariableDescription> variables = Maps.newLinkedHashMap();
    final Map<String, String> metadata = Maps.newLinkedHashMap();
    int headerLine = 0;
    String name = Constants.DEFAULT_SEQUENCE_NAME;
    String type = Constants.DEFAULT_EXPERIMENT_TYPE;
    Quantity duration = null;
    BigDecimal sampleRate = Constants.DEFAULT_SAMPLE_RATE;
    long repeatCount = Constants.DEFAULT_REPEAT_COUNT;

    ParseState() {
      blocks.push(new Block(BlockKind.ROOT, "", 0));
    }

    Block current() {
      return blocks.peek();
    }

    void declare(VariableDescription v, int line) {
      if (variables.containsKey(v.getName())) {
        throw new SequenceSyntaxException(line, v.getName(), "variable is already declared");
      }
      variables.put(v.getName(), v);
    }

    SequenceDescription build() {
      return new SequenceDescription(name, type, duration, sampleRate, repeatCount,
          Lists.newArrayList(variables.values()), blocks.peek().nodes, metadata);
    }
  }
}
